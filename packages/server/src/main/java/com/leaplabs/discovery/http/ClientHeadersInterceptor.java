package com.leaplabs.discovery.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Stamps every outbound service request with the client type and JSON accept headers. */
public class ClientHeadersInterceptor implements Interceptor {
  private final String clientType;

  public ClientHeadersInterceptor(String clientType) {
    this.clientType = clientType;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Request.Builder builder = original.newBuilder().header("X-Client-Type", clientType);
    if (original.header("Accept") == null) {
      builder.header("Accept", "application/json");
    }
    return chain.proceed(builder.build());
  }
}
