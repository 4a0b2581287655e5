package com.leaplabs.discovery.client;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaplabs.discovery.DiscoverySettings;
import com.leaplabs.discovery.estimate.Visibility;
import com.leaplabs.discovery.exception.AuthenticationException;
import com.leaplabs.discovery.exception.DiscoveryErrorCode;
import com.leaplabs.discovery.exception.JobNotFoundException;
import com.leaplabs.discovery.exception.RemoteServiceException;
import com.leaplabs.discovery.exception.ServiceUnavailableException;
import com.leaplabs.discovery.exception.ValidationException;
import com.leaplabs.discovery.http.OkHttpFactory;
import com.leaplabs.discovery.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiscoveryHttpClientTest {

  @TempDir Path tmp;

  private MockWebServer server;
  private DiscoveryHttpClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    DiscoverySettings settings = DiscoverySettings.defaults();
    OkHttpClient http = OkHttpFactory.create(settings);
    String base = server.url("/").toString();
    client =
        new DiscoveryHttpClient(
            http,
            OkHttpFactory.createUploadClient(http, settings),
            base,
            base,
            new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5)));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private static MockResponse json(int code, String body) {
    return new MockResponse()
        .setResponseCode(code)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }

  @Test
  void accountSendsBearerKeyAndClientHeaders() throws Exception {
    server.enqueue(json(200, "{\"available_credits\":12}"));

    JsonNode account = client.account("disco_abc");

    assertEquals(12, account.path("available_credits").asInt());
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("/v1/account", request.getPath());
    assertEquals("Bearer disco_abc", request.getHeader("Authorization"));
    assertEquals("mcp", request.getHeader("X-Client-Type"));
  }

  @Test
  void plansNeedNoKey() throws Exception {
    server.enqueue(json(200, "{\"plans\":[]}"));
    client.listPlans();
    assertNull(server.takeRequest().getHeader("Authorization"));
  }

  @Test
  void serverErrorsAreRetried() throws Exception {
    server.enqueue(json(503, "{\"detail\":\"busy\"}"));
    server.enqueue(json(502, "bad gateway"));
    server.enqueue(json(200, "{\"available_credits\":1}"));

    assertEquals(1, client.account("k").path("available_credits").asInt());
    assertEquals(3, server.getRequestCount());
  }

  @Test
  void exhaustedRetriesSurfaceAsServiceUnavailable() {
    for (int i = 0; i < 3; i++) {
      server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1"));
    }
    ServiceUnavailableException e =
        assertThrows(ServiceUnavailableException.class, () -> client.account("k"));
    assertEquals(DiscoveryErrorCode.UNAVAILABLE, e.getCode());
    assertEquals(3, server.getRequestCount());
  }

  @Test
  void purchaseIsSentOnceEvenWhenTheGatewayTimesOut() {
    server.enqueue(json(504, "{\"detail\":\"gateway timeout\"}"));
    server.enqueue(json(200, "{\"credits_added\":20}"));

    ServiceUnavailableException e =
        assertThrows(ServiceUnavailableException.class, () -> client.purchaseCredits("k", 1));

    assertEquals(1, server.getRequestCount());
    assertEquals(1, e.getContext().get("attempts"));
  }

  @Test
  void accountMutationsAreNotRepeatedAfterServerErrors() {
    for (int i = 0; i < 3; i++) {
      server.enqueue(json(502, "bad gateway"));
    }
    assertThrows(ServiceUnavailableException.class, () -> client.subscribe("k", "tier_1"));
    assertThrows(
        ServiceUnavailableException.class, () -> client.addPaymentMethod("k", "pm_card_visa"));
    assertThrows(ServiceUnavailableException.class, () -> client.signup("a@b.c", "Ada"));
    assertEquals(3, server.getRequestCount());
  }

  @Test
  void unauthorisedIsNotRetried() {
    server.enqueue(json(401, "{\"detail\":\"bad key\"}"));
    assertThrows(AuthenticationException.class, () -> client.account("k"));
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void clientErrorsCarryTheServiceDetail() {
    server.enqueue(json(400, "{\"detail\":\"packs must be positive\"}"));
    RemoteServiceException e =
        assertThrows(RemoteServiceException.class, () -> client.purchaseCredits("k", 1));
    assertEquals(400, e.getHttpStatus());
    assertEquals(DiscoveryErrorCode.INVALID_ARGUMENT, e.getCode());
    assertTrue(e.getMessage().contains("packs must be positive"));
  }

  @Test
  void signupConflictMeansAlreadyRegistered() {
    server.enqueue(json(409, "{\"detail\":\"exists\"}"));
    RemoteServiceException e =
        assertThrows(RemoteServiceException.class, () -> client.signup("a@b.c", null));
    assertEquals(DiscoveryErrorCode.ALREADY_EXISTS, e.getCode());
  }

  @Test
  void runStatusMapsFieldsAndNotFound() throws Exception {
    server.enqueue(
        json(
            200,
            "{\"run_id\":\"r1\",\"status\":\"processing\",\"job_id\":\"j1\","
                + "\"job_status\":\"running\",\"patterns\":[]}"));
    server.enqueue(json(404, "{\"detail\":\"no such run\"}"));

    RemoteRunStatus status = client.runStatus("k", "r1");
    assertEquals("processing", status.status());
    assertEquals("j1", status.jobId());
    assertEquals("/api/runs/r1/results", server.takeRequest().getPath());

    assertThrows(JobNotFoundException.class, () -> client.runStatus("k", "r2"));
  }

  @Test
  void createRunSendsIdempotencyKeyAndTreatsConflictAsDuplicate() throws Exception {
    server.enqueue(json(200, "{\"run_id\":\"r-new\"}"));
    server.enqueue(json(409, "{\"run_id\":\"r-new\",\"detail\":\"duplicate\"}"));

    RunSubmission submission =
        new RunSubmission(
            new UploadedDataset(
                "k1", "d.csv", 10, "h", JacksonUtility.readTree("[{\"name\":\"a\"}]")),
            "y",
            2,
            Visibility.PRIVATE,
            "Title",
            null,
            Map.of("a", "first column"),
            "disco-123");

    CreateRunResult first = client.createRun("k", submission);
    CreateRunResult second = client.createRun("k", submission);

    assertEquals("r-new", first.runId());
    assertFalse(first.duplicate());
    assertEquals("r-new", second.runId());
    assertTrue(second.duplicate());

    RecordedRequest request = server.takeRequest();
    assertEquals("/api/reports/create-from-upload", request.getPath());
    assertEquals("disco-123", request.getHeader("Idempotency-Key"));
    JsonNode body = JacksonUtility.readTree(request.getBody().readUtf8());
    assertEquals("disco-123", body.path("idempotencyKey").asText());
    assertFalse(body.path("isPublic").asBoolean(true));
    assertEquals(2, body.path("depthIterations").asInt());
    assertEquals("first column", body.path("columnDescriptions").path("a").asText());
    assertFalse(body.has("description"));
  }

  @Test
  void uploadPresignsPutsAndFinalizes() throws Exception {
    Path file = tmp.resolve("d.csv");
    Files.writeString(file, "a,b,y\n1,2,3\n");
    String uploadUrl = server.url("/storage/d.csv").toString();

    server.enqueue(
        json(
            200,
            "{\"uploadUrl\":\"" + uploadUrl + "\",\"key\":\"k1\",\"uploadToken\":\"t1\"}"));
    server.enqueue(new MockResponse().setResponseCode(200));
    server.enqueue(
        json(
            200,
            "{\"ok\":true,\"file\":{\"key\":\"k1\",\"name\":\"d.csv\",\"size\":12,"
                + "\"fileHash\":\"abc\"},\"columns\":[{\"name\":\"a\"},{\"name\":\"b\"},"
                + "{\"name\":\"y\"}]}"));

    UploadedDataset uploaded = client.uploadDataset("key", file, DatasetFormat.CSV);

    assertEquals("abc", uploaded.fileHash());
    assertEquals(3, uploaded.columnCount());

    RecordedRequest presign = server.takeRequest();
    assertEquals("/api/data/upload/presign", presign.getPath());
    JsonNode presignBody = JacksonUtility.readTree(presign.getBody().readUtf8());
    assertEquals("d.csv", presignBody.path("fileName").asText());
    assertEquals("text/csv", presignBody.path("contentType").asText());

    RecordedRequest put = server.takeRequest();
    assertEquals("PUT", put.getMethod());
    assertNull(put.getHeader("Authorization"));
    assertEquals("a,b,y\n1,2,3\n", put.getBody().readUtf8());

    RecordedRequest finalize = server.takeRequest();
    assertEquals("/api/data/upload/finalize", finalize.getPath());
  }

  @Test
  void finalizeProblemsBecomeValidationErrors() throws Exception {
    Path file = tmp.resolve("d.csv");
    Files.writeString(file, "a\n1\n");
    server.enqueue(
        json(
            200,
            "{\"uploadUrl\":\""
                + server.url("/storage/d.csv")
                + "\",\"key\":\"k1\",\"uploadToken\":\"t1\"}"));
    server.enqueue(new MockResponse().setResponseCode(200));
    server.enqueue(
        json(200, "{\"ok\":false,\"issues\":{\"errors\":[{\"message\":\"Too few rows\"}]}}"));

    ValidationException e =
        assertThrows(
            ValidationException.class, () -> client.uploadDataset("key", file, DatasetFormat.CSV));
    assertEquals("Too few rows", e.getMessage());
  }
}
