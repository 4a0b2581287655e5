package com.leaplabs.discovery.http;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(LoggingInterceptor.class);

  static final String REDACTED = "[REDACTED]";

  private final boolean logBodies;

  public LoggingInterceptor() {
    this(true);
  }

  /**
   * @param logBodies false for upload traffic, where the request body is the whole dataset
   */
  public LoggingInterceptor(boolean logBodies) {
    this.logBodies = logBodies;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url().newBuilder().query(null).build(),
          redact(request.headers()),
          logBodies ? bodyToString(request) : "(omitted)");
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} {} in {} ms, status {}",
        request.method(),
        response.request().url().encodedPath(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (logBodies && log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(Long.MAX_VALUE);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }

  static Headers redact(Headers headers) {
    if (headers.get("Authorization") == null) {
      return headers;
    }
    return headers.newBuilder().set("Authorization", REDACTED).build();
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
