package com.leaplabs.discovery.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaplabs.discovery.FakeDiscoveryApi;
import com.leaplabs.discovery.MutableClock;
import com.leaplabs.discovery.account.AccountTracker;
import com.leaplabs.discovery.estimate.CostEstimator;
import com.leaplabs.discovery.estimate.Visibility;
import com.leaplabs.discovery.exception.InsufficientCreditsException;
import com.leaplabs.discovery.exception.InvalidStateException;
import com.leaplabs.discovery.exception.JobNotFoundException;
import com.leaplabs.discovery.exception.TransientNetworkException;
import com.leaplabs.discovery.exception.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobLifecycleManagerTest {

  @TempDir Path tmp;

  private FakeDiscoveryApi api;
  private MutableClock clock;
  private AccountTracker accounts;
  private JobLifecycleManager manager;
  private Path dataset;

  @BeforeEach
  void setUp() throws Exception {
    api = new FakeDiscoveryApi();
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    accounts = new AccountTracker(api, clock, Duration.ofSeconds(60));
    manager = newManager();
    dataset = tmp.resolve("sales.csv");
    Files.writeString(dataset, "a,b,c,d,revenue\n1,2,3,4,5\n");
  }

  private JobLifecycleManager newManager() {
    return new JobLifecycleManager(
        api,
        accounts,
        new CostEstimator(),
        new AnalysisRequestValidator(),
        new PollBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60)),
        clock,
        Duration.ofMinutes(120));
  }

  private AnalysisRequest.Builder request() {
    return AnalysisRequest.builder(dataset, "revenue");
  }

  private AnalysisRequest privateRequest(String token) {
    return request().visibility(Visibility.PRIVATE).idempotencyToken(token).build();
  }

  @Test
  void submitReturnsQueuedRunWithoutWaiting() {
    SubmissionReceipt receipt = manager.submit("k", request().build());

    assertEquals("run-1", receipt.runId());
    assertEquals(JobStatus.QUEUED, receipt.status());
    assertFalse(receipt.duplicate());
    assertEquals(5, receipt.nextPollSeconds());
    assertEquals(0, api.statusCalls.get());
  }

  @Test
  @DisplayName("same token submitted twice: one upload, one create, one run id")
  void repeatedTokenIsSubmittedOnce() {
    SubmissionReceipt first = manager.submit("k", privateRequest("tok-1"));
    SubmissionReceipt second = manager.submit("k", privateRequest("tok-1"));

    assertEquals(first.runId(), second.runId());
    assertTrue(second.duplicate());
    assertEquals(1, api.uploads.get());
    assertEquals(1, api.createRunCalls.get());
    assertEquals("tok-1", api.submissions.get(0).idempotencyKey());
  }

  @Test
  void sameNonceDerivesTheSameToken() {
    manager.submit("k", request().nonce("n-1").build());
    manager.submit("k", request().nonce("n-1").build());
    assertEquals(1, api.createRunCalls.get());

    manager.submit("k", request().nonce("n-2").build());
    assertEquals(2, api.createRunCalls.get());
  }

  @Test
  void withoutTokenOrNonceEachCallIsANewSubmission() {
    String a = manager.submit("k", request().build()).runId();
    String b = manager.submit("k", request().build()).runId();
    assertNotEquals(a, b);
  }

  @Test
  void serviceRecognisesATokenThisProcessHasNotSeen() {
    String runId = manager.submit("k", privateRequest("tok-restart")).runId();
    long creditsAfterFirst = api.credits;

    // A fresh manager stands in for a restarted process.
    SubmissionReceipt retried = newManager().submit("k", privateRequest("tok-restart"));

    assertEquals(runId, retried.runId());
    assertEquals(creditsAfterFirst, api.credits);
  }

  @Test
  void concurrentSubmissionsWithOneTokenShareOneRun() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        Callable<String> call =
            () -> {
              start.await();
              return manager.submit("k", privateRequest("tok-concurrent")).runId();
            };
        results.add(pool.submit(call));
      }
      start.countDown();
      Set<String> runIds = new HashSet<>();
      for (Future<String> f : results) {
        runIds.add(f.get(10, TimeUnit.SECONDS));
      }
      assertEquals(1, runIds.size());
      assertEquals(1, api.createRunCalls.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void failedSubmissionCanBeRetriedWithTheSameToken() {
    api.nextCreateFailure = new TransientNetworkException("connection reset");
    assertThrows(TransientNetworkException.class, () -> manager.submit("k", privateRequest("t")));

    SubmissionReceipt retry = manager.submit("k", privateRequest("t"));
    assertEquals(2, api.createRunCalls.get());
    assertFalse(retry.duplicate());
  }

  @Test
  void statusAdvancesAndResultsAreGatedOnCompletion() {
    String runId = manager.submit("k", request().build()).runId();

    assertEquals(JobStatus.QUEUED, manager.poll("k", runId).status());

    api.setStatus(runId, "processing");
    JobStatusView running = manager.poll("k", runId);
    assertEquals(JobStatus.RUNNING, running.status());
    assertEquals(20, running.nextPollSeconds());

    InvalidStateException notYet =
        assertThrows(InvalidStateException.class, () -> manager.fetchResults("k", runId));
    assertEquals("running", notYet.getContext().get("status"));
    assertEquals(0, api.resultCalls.get());

    api.setStatus(runId, "completed");
    JobStatusView done = manager.poll("k", runId);
    assertEquals(JobStatus.COMPLETED, done.status());
    assertNull(done.nextPollSeconds());

    JsonNode results = manager.fetchResults("k", runId);
    assertEquals(runId, results.path("run_id").asText());
    assertEquals(0, manager.trackedJobs());
  }

  @Test
  void statusNeverMovesBackwards() {
    String runId = manager.submit("k", request().build()).runId();
    api.setStatus(runId, "running");
    manager.poll("k", runId);

    api.setStatus(runId, "pending");
    assertEquals(JobStatus.RUNNING, manager.poll("k", runId).status());
  }

  @Test
  void terminalStatusIsAnsweredWithoutNetwork() {
    String runId = manager.submit("k", request().build()).runId();
    api.setStatus(runId, "completed");
    manager.poll("k", runId);
    int calls = api.statusCalls.get();

    manager.poll("k", runId);
    manager.poll("k", runId);
    assertEquals(calls, api.statusCalls.get());
  }

  @Test
  void failureCarriesTheServiceReason() {
    String runId = manager.submit("k", request().build()).runId();
    api.fail(runId, "Target column has a single value");

    JobStatusView view = manager.poll("k", runId);
    assertEquals(JobStatus.FAILED, view.status());
    assertEquals("Target column has a single value", view.failureReason());
    assertThrows(InvalidStateException.class, () -> manager.fetchResults("k", runId));
  }

  @Test
  void runForgottenByTheServiceExpiresRatherThanFails() {
    String runId = manager.submit("k", request().build()).runId();
    api.forget(runId);

    JobStatusView view = manager.poll("k", runId);
    assertEquals(JobStatus.EXPIRED, view.status());
    assertNotNull(view.failureReason());
  }

  @Test
  void unknownRunIdIsNotFound() {
    assertThrows(JobNotFoundException.class, () -> manager.poll("k", "run-404"));
    assertTrue(manager.find("run-404").isEmpty());
  }

  @Test
  void runIdFromAnEarlierSessionIsAdopted() {
    api.setStatus("run-old", "processing");
    assertEquals(JobStatus.RUNNING, manager.poll("k", "run-old").status());
    assertTrue(manager.find("run-old").isPresent());
  }

  @Test
  void privateRunBeyondTheBalanceIsRejectedBeforeUpload() {
    api.credits = 0;
    InsufficientCreditsException e =
        assertThrows(
            InsufficientCreditsException.class, () -> manager.submit("k", privateRequest("t")));
    assertEquals(0L, e.getContext().get("balance"));
    assertEquals(1L, e.getContext().get("estimated_credits"));
    assertEquals(0, api.uploads.get());
  }

  @Test
  void publicRunSkipsTheAffordabilityCheck() {
    api.credits = 0;
    assertNotNull(manager.submit("k", request().build()).runId());
    assertEquals(0, api.accountCalls.get());
  }

  @Test
  void privateSubmissionInvalidatesTheCachedBalance() {
    assertEquals(100, accounts.snapshot("k").credits());
    manager.submit("k", privateRequest("t"));

    assertEquals(99, accounts.snapshot("k").credits());
    assertEquals(2, api.accountCalls.get());
  }

  @Test
  void depthIsCheckedAgainstUploadedColumnsBeforeCreatingTheRun() {
    api.uploadedColumns = 5;
    AnalysisRequest tooDeep =
        request().visibility(Visibility.PRIVATE).depth(4).idempotencyToken("t").build();

    assertThrows(ValidationException.class, () -> manager.submit("k", tooDeep));
    assertEquals(0, api.createRunCalls.get());
  }

  @Test
  void abandonedJobsAreEvicted() {
    String runId = manager.submit("k", request().build()).runId();
    clock.advance(Duration.ofMinutes(121));

    assertEquals(1, manager.evictAbandoned());
    assertTrue(manager.find(runId).isEmpty());
    assertEquals(0, manager.trackedJobs());
  }

  @Test
  void pollingKeepsAJobAlive() {
    String runId = manager.submit("k", request().build()).runId();
    clock.advance(Duration.ofMinutes(100));
    manager.poll("k", runId);
    clock.advance(Duration.ofMinutes(100));

    assertEquals(0, manager.evictAbandoned());
    assertTrue(manager.find(runId).isPresent());
  }

  @Test
  void lookingAtAJobDoesNotKeepItAlive() {
    String runId = manager.submit("k", request().build()).runId();
    clock.advance(Duration.ofMinutes(100));
    assertTrue(manager.find(runId).isPresent());
    clock.advance(Duration.ofMinutes(30));

    assertEquals(1, manager.evictAbandoned());
    assertTrue(manager.find(runId).isEmpty());
  }

  @Test
  void expiredTokensAreLeftToTheServiceToDeduplicate() {
    String first = manager.submit("k", privateRequest("tok-9")).runId();
    clock.advance(Duration.ofMinutes(121));

    SubmissionReceipt again = manager.submit("k", privateRequest("tok-9"));

    // Forgotten locally, so the create call goes out again and the service matches the token.
    assertEquals(2, api.createRunCalls.get());
    assertEquals(first, again.runId());
    assertEquals("tok-9", api.submissions.get(1).idempotencyKey());
  }
}
