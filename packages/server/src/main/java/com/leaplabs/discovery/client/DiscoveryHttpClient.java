package com.leaplabs.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leaplabs.discovery.DiscoverySettings;
import com.leaplabs.discovery.exception.AuthenticationException;
import com.leaplabs.discovery.exception.DiscoveryErrorCode;
import com.leaplabs.discovery.exception.IoException;
import com.leaplabs.discovery.exception.JobNotFoundException;
import com.leaplabs.discovery.exception.RemoteServiceException;
import com.leaplabs.discovery.exception.SerializationException;
import com.leaplabs.discovery.exception.TransientNetworkException;
import com.leaplabs.discovery.exception.ValidationException;
import com.leaplabs.discovery.http.OkHttpFactory;
import com.leaplabs.discovery.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OkHttp implementation of {@link DiscoveryApi}.
 *
 * <p>Account and plan operations go to the API host; upload, run creation, status and results go
 * to the dashboard host. Reads and uploads run under the {@link RetryPolicy}: I/O failures,
 * timeouts, 429 and 5xx responses are retried, anything else is mapped to a non-retryable
 * exception on the first attempt. Run creation is retried too; it carries the idempotency token on
 * every attempt, so a retry after a lost acknowledgment returns the existing run. Signup, payment
 * method, credit purchase and subscription carry no such token and are sent exactly once.
 */
public class DiscoveryHttpClient implements DiscoveryApi {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(DiscoveryHttpClient.class);

  static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

  @FunctionalInterface
  private interface ResponseMapper<T> {
    T map(Response response, JsonNode body);
  }

  private final OkHttpClient http;
  private final OkHttpClient uploadHttp;
  private final HttpUrl apiBase;
  private final HttpUrl dashboardBase;
  private final RetryPolicy retryPolicy;
  private final RetryPolicy singleAttempt;

  public DiscoveryHttpClient(
      OkHttpClient http,
      OkHttpClient uploadHttp,
      String apiBaseUrl,
      String dashboardBaseUrl,
      RetryPolicy retryPolicy) {
    this.http = http;
    this.uploadHttp = uploadHttp;
    this.apiBase = parseBase(apiBaseUrl, "discovery.api.base-url");
    this.dashboardBase = parseBase(dashboardBaseUrl, "discovery.dashboard.base-url");
    this.retryPolicy = retryPolicy;
    this.singleAttempt = retryPolicy.withoutRetries();
  }

  public static DiscoveryHttpClient create(DiscoverySettings settings) {
    OkHttpClient http = OkHttpFactory.create(settings);
    return new DiscoveryHttpClient(
        http,
        OkHttpFactory.createUploadClient(http, settings),
        settings.apiBaseUrl(),
        settings.dashboardBaseUrl(),
        new RetryPolicy(
            settings.retryMaxAttempts(),
            settings.retryInitialBackoff(),
            settings.retryMaxBackoff()));
  }

  // ---------------------------------------------------------------------------
  // Account and plans
  // ---------------------------------------------------------------------------

  @Override
  public JsonNode listPlans() {
    return execute("list plans", get(url(apiBase, "v1/plans"), null), DiscoveryHttpClient::body);
  }

  @Override
  public JsonNode signup(String email, String name) {
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode().put("email", email);
    if (name != null && !name.isBlank()) {
      payload.put("name", name);
    }
    return executeOnce(
        "signup",
        post(url(apiBase, "v1/signup"), null, payload),
        (response, body) -> {
          if (response.code() == 409) {
            throw new RemoteServiceException(
                DiscoveryErrorCode.ALREADY_EXISTS,
                409,
                "An account with this email is already registered.");
          }
          return body(response, body);
        });
  }

  @Override
  public JsonNode account(String apiKey) {
    return execute("account", get(url(apiBase, "v1/account"), apiKey), DiscoveryHttpClient::body);
  }

  @Override
  public JsonNode addPaymentMethod(String apiKey, String paymentMethodId) {
    ObjectNode payload =
        JacksonUtility.getJsonMapper()
            .createObjectNode()
            .put("payment_method_id", paymentMethodId);
    return executeOnce(
        "add payment method",
        post(url(apiBase, "v1/account/payment-method"), apiKey, payload),
        DiscoveryHttpClient::body);
  }

  @Override
  public JsonNode purchaseCredits(String apiKey, int packs) {
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode().put("packs", packs);
    return executeOnce(
        "purchase credits",
        post(url(apiBase, "v1/account/credits/purchase"), apiKey, payload),
        DiscoveryHttpClient::body);
  }

  @Override
  public JsonNode subscribe(String apiKey, String plan) {
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode().put("plan", plan);
    return executeOnce(
        "subscribe",
        post(url(apiBase, "v1/account/subscribe"), apiKey, payload),
        DiscoveryHttpClient::body);
  }

  // ---------------------------------------------------------------------------
  // Upload and runs
  // ---------------------------------------------------------------------------

  @Override
  public UploadedDataset uploadDataset(String apiKey, Path file, DatasetFormat format) {
    long size;
    try {
      size = Files.size(file);
    } catch (IOException e) {
      throw new IoException("Cannot read dataset file " + file, e);
    }
    String fileName = file.getFileName().toString();

    ObjectNode presignPayload =
        JacksonUtility.getJsonMapper()
            .createObjectNode()
            .put("fileName", fileName)
            .put("contentType", format.contentType())
            .put("fileSize", size);
    JsonNode presign =
        execute(
            "presign upload",
            post(url(dashboardBase, "api/data/upload/presign"), apiKey, presignPayload),
            DiscoveryHttpClient::body);

    String uploadUrl = text(presign, "uploadUrl");
    String key = text(presign, "key");
    String uploadToken = text(presign, "uploadToken");
    if (uploadUrl == null || key == null || uploadToken == null) {
      throw new RemoteServiceException(
          DiscoveryErrorCode.ABORTED, 200, "Failed to get upload URL from API.");
    }

    HttpUrl target = HttpUrl.parse(uploadUrl);
    if (target == null) {
      throw new RemoteServiceException(
          DiscoveryErrorCode.ABORTED, 200, "Service returned an invalid upload URL.");
    }
    MediaType contentType = MediaType.get(format.contentType());
    log.info("Uploading {} ({} bytes) as {}", fileName, size, format.contentType());
    retryPolicy.execute(
        "upload dataset",
        () -> {
          Request put =
              new Request.Builder()
                  .url(target)
                  .put(RequestBody.create(file.toFile(), contentType))
                  .build();
          try (Response response = uploadHttp.newCall(put).execute()) {
            if (isTransient(response.code())) {
              throw transientStatus("upload dataset", response);
            }
            if (!response.isSuccessful()) {
              throw new RemoteServiceException(
                  DiscoveryErrorCode.ABORTED,
                  response.code(),
                  "File upload failed: " + response.code());
            }
            return null;
          } catch (IOException e) {
            throw transientIo("upload dataset", e);
          }
        });

    ObjectNode finalizePayload =
        JacksonUtility.getJsonMapper()
            .createObjectNode()
            .put("key", key)
            .put("uploadToken", uploadToken);
    JsonNode finalized =
        execute(
            "finalize upload",
            post(url(dashboardBase, "api/data/upload/finalize"), apiKey, finalizePayload),
            DiscoveryHttpClient::body);

    if (!finalized.path("ok").asBoolean(false)) {
      JsonNode errors = finalized.path("issues").path("errors");
      String message =
          errors.isArray() && errors.size() > 0
              ? errors.get(0).path("message").asText("Upload finalize failed")
              : "Upload finalize failed";
      throw new ValidationException(message, Map.of("stage", "finalize", "file", fileName));
    }

    JsonNode stored = finalized.path("file");
    return new UploadedDataset(
        stored.path("key").asText(key),
        stored.path("name").asText(fileName),
        stored.path("size").asLong(size),
        text(stored, "fileHash"),
        finalized.path("columns"));
  }

  @Override
  public CreateRunResult createRun(String apiKey, RunSubmission submission) {
    UploadedDataset dataset = submission.dataset();
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
    ObjectNode file = payload.putObject("file");
    file.put("key", dataset.key());
    file.put("name", dataset.name());
    file.put("size", dataset.size());
    file.put("fileHash", dataset.fileHash());
    if (dataset.columns() != null && !dataset.columns().isMissingNode()) {
      payload.set("columns", dataset.columns());
    } else {
      payload.putArray("columns");
    }
    payload.put("targetColumn", submission.targetColumn());
    payload.put("depthIterations", submission.depth());
    payload.put("isPublic", submission.visibility().isPublic());
    if (submission.title() != null && !submission.title().isBlank()) {
      payload.put("title", submission.title());
    }
    if (submission.description() != null && !submission.description().isBlank()) {
      payload.put("description", submission.description());
    }
    if (submission.columnDescriptions() != null && !submission.columnDescriptions().isEmpty()) {
      ObjectNode descriptions = payload.putObject("columnDescriptions");
      submission.columnDescriptions().forEach(descriptions::put);
    }
    payload.put("idempotencyKey", submission.idempotencyKey());

    Request request =
        post(url(dashboardBase, "api/reports/create-from-upload"), apiKey, payload)
            .newBuilder()
            .header(IDEMPOTENCY_HEADER, submission.idempotencyKey())
            .build();

    return execute(
        "create run",
        request,
        (response, body) -> {
          if (response.code() == 409) {
            String existing = runIdOf(body);
            if (existing == null) {
              throw new RemoteServiceException(
                  DiscoveryErrorCode.ALREADY_EXISTS,
                  409,
                  "Service reported a conflicting run but returned no run id: " + detail(body));
            }
            log.info("Idempotency key already used; service returned existing run {}", existing);
            return new CreateRunResult(existing, true);
          }
          JsonNode accepted = body(response, body);
          String runId = runIdOf(accepted);
          if (runId == null) {
            throw new RemoteServiceException(
                DiscoveryErrorCode.ABORTED,
                response.code(),
                "Service accepted the run but returned no run id.");
          }
          return new CreateRunResult(runId, accepted.path("duplicate").asBoolean(false));
        });
  }

  @Override
  public RemoteRunStatus runStatus(String apiKey, String runId) {
    return execute(
        "run status",
        get(runResultsUrl(runId), apiKey),
        (response, body) -> {
          if (response.code() == 404) {
            throw new JobNotFoundException(runId);
          }
          JsonNode result = body(response, body);
          return new RemoteRunStatus(
              text(result, "run_id") == null ? runId : text(result, "run_id"),
              text(result, "status"),
              text(result, "job_id"),
              text(result, "job_status"),
              text(result, "error_message"));
        });
  }

  @Override
  public JsonNode runResults(String apiKey, String runId) {
    return execute(
        "run results",
        get(runResultsUrl(runId), apiKey),
        (response, body) -> {
          if (response.code() == 404) {
            throw new JobNotFoundException(runId);
          }
          return body(response, body);
        });
  }

  // ---------------------------------------------------------------------------
  // Plumbing
  // ---------------------------------------------------------------------------

  private <T> T execute(String operation, Request request, ResponseMapper<T> mapper) {
    return exchange(retryPolicy, operation, request, mapper);
  }

  private <T> T executeOnce(String operation, Request request, ResponseMapper<T> mapper) {
    return exchange(singleAttempt, operation, request, mapper);
  }

  private <T> T exchange(
      RetryPolicy policy, String operation, Request request, ResponseMapper<T> mapper) {
    return policy.execute(
        operation,
        () -> {
          try (Response response = http.newCall(request).execute()) {
            if (isTransient(response.code())) {
              throw transientStatus(operation, response);
            }
            JsonNode body = readBody(response);
            return mapper.map(response, body);
          } catch (IOException e) {
            throw transientIo(operation, e);
          }
        });
  }

  /** Default mapping: 2xx returns the body, anything else becomes a typed exception. */
  private static JsonNode body(Response response, JsonNode body) {
    int code = response.code();
    if (response.isSuccessful()) {
      return body;
    }
    if (code == 401 || code == 403) {
      throw new AuthenticationException(
          "Authentication failed. Check your API key or session token.");
    }
    if (code == 402) {
      throw new RemoteServiceException(
          DiscoveryErrorCode.FAILED_PRECONDITION,
          code,
          "Payment required. Add a payment method first.");
    }
    DiscoveryErrorCode errorCode =
        switch (code) {
          case 400, 422 -> DiscoveryErrorCode.INVALID_ARGUMENT;
          case 404 -> DiscoveryErrorCode.NOT_FOUND;
          case 409 -> DiscoveryErrorCode.ALREADY_EXISTS;
          default -> DiscoveryErrorCode.FAILED_PRECONDITION;
        };
    throw new RemoteServiceException(
        errorCode, code, "API error (%d): %s".formatted(code, detail(body)));
  }

  private static boolean isTransient(int code) {
    return code == 429 || code >= 500;
  }

  private static TransientNetworkException transientStatus(String operation, Response response) {
    if (response.code() == 429) {
      long retryAfter = parseRetryAfter(response.header("Retry-After"));
      return new TransientNetworkException(
          "%s rate limited. Retry after %d seconds.".formatted(operation, retryAfter),
          Map.of("http_status", 429, "retry_after_seconds", retryAfter));
    }
    return new TransientNetworkException(
        "%s failed with HTTP %d".formatted(operation, response.code()),
        Map.of("http_status", response.code()));
  }

  private static TransientNetworkException transientIo(String operation, IOException e) {
    String kind = e instanceof InterruptedIOException ? "timed out" : "connection failed";
    return new TransientNetworkException("%s %s: %s".formatted(operation, kind, e.getMessage()), e);
  }

  private static long parseRetryAfter(String header) {
    if (header == null) return 60L;
    try {
      return Math.max(0L, Long.parseLong(header.trim()));
    } catch (NumberFormatException e) {
      return 60L;
    }
  }

  private static JsonNode readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    if (body == null) {
      return JacksonUtility.getJsonMapper().createObjectNode();
    }
    String text = body.string();
    try {
      return JacksonUtility.readTree(text);
    } catch (SerializationException e) {
      if (response.isSuccessful()) {
        throw e;
      }
      // Error pages are often plain text or HTML; keep them as the detail.
      return JacksonUtility.getJsonMapper().createObjectNode().put("detail", text);
    }
  }

  private static String detail(JsonNode body) {
    JsonNode detail = body == null ? null : body.get("detail");
    if (detail == null || detail.isNull()) {
      return body == null ? "" : body.toString();
    }
    return detail.isTextual() ? detail.asText() : detail.toString();
  }

  private static String runIdOf(JsonNode body) {
    for (String field : new String[] {"run_id", "runId", "existing_run_id", "id"}) {
      String value = text(body, field);
      if (value != null) return value;
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    if (node == null) return null;
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return null;
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private HttpUrl runResultsUrl(String runId) {
    return dashboardBase
        .newBuilder()
        .addPathSegments("api/runs")
        .addPathSegment(runId)
        .addPathSegment("results")
        .build();
  }

  private static HttpUrl url(HttpUrl base, String path) {
    return base.newBuilder().addPathSegments(path).build();
  }

  private static Request get(HttpUrl url, String apiKey) {
    return authorized(new Request.Builder().url(url).get(), apiKey).build();
  }

  private static Request post(HttpUrl url, String apiKey, JsonNode payload) {
    RequestBody body = RequestBody.create(JacksonUtility.toJson(payload), JSON);
    return authorized(new Request.Builder().url(url).post(body), apiKey).build();
  }

  private static Request.Builder authorized(Request.Builder builder, String apiKey) {
    if (apiKey != null && !apiKey.isBlank()) {
      builder.header("Authorization", "Bearer " + apiKey);
    }
    return builder;
  }

  private static HttpUrl parseBase(String url, String key) {
    HttpUrl parsed = url == null ? null : HttpUrl.parse(url);
    if (parsed == null) {
      throw new com.leaplabs.discovery.exception.ConfigException(
          "Invalid URL for " + key + ": " + url);
    }
    return parsed;
  }
}
