package com.leaplabs.discovery.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import com.leaplabs.discovery.account.AccountTracker;
import com.leaplabs.discovery.client.CreateRunResult;
import com.leaplabs.discovery.client.DiscoveryApi;
import com.leaplabs.discovery.client.RemoteRunStatus;
import com.leaplabs.discovery.client.RunSubmission;
import com.leaplabs.discovery.client.UploadedDataset;
import com.leaplabs.discovery.estimate.CostEstimate;
import com.leaplabs.discovery.estimate.CostEstimator;
import com.leaplabs.discovery.exception.InsufficientCreditsException;
import com.leaplabs.discovery.exception.InvalidStateException;
import com.leaplabs.discovery.exception.JobNotFoundException;
import com.leaplabs.discovery.exception.ValidationException;
import com.leaplabs.discovery.utility.ClockTicker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives analysis runs through submit, poll and fetch as discrete, non-blocking steps.
 *
 * <p>Nothing here loops or sleeps: {@link #submit} returns once the service has issued a run id,
 * {@link #poll} performs at most one status exchange, and the caller decides when to poll again
 * (each view carries a suggested delay).
 *
 * <p>At-most-once billing rests on the submission token. Every logical submission carries one
 * token, stable across retries of that submission. A token this process has already seen
 * accepted returns the existing run id without touching the network; concurrent submissions with
 * the same token share a single in-flight attempt; and the token travels with the create-run
 * call so the service can de-duplicate retries this process cannot see.
 *
 * <p>Jobs and accepted tokens are held in caches that expire after the TTL without caller
 * activity. A job that expires before reaching a terminal state is marked {@link
 * JobStatus#EXPIRED} on its way out.
 */
public class JobLifecycleManager {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(JobLifecycleManager.class);

  private record Accepted(String runId, CostEstimate estimate) {}

  private final DiscoveryApi api;
  private final AccountTracker accounts;
  private final CostEstimator estimator;
  private final AnalysisRequestValidator validator;
  private final PollBackoff pollBackoff;
  private final Clock clock;
  private final Duration jobTtl;

  private final Cache<String, Job> jobs;
  private final Cache<String, CompletableFuture<Accepted>> submissions;
  private final AtomicInteger abandoned = new AtomicInteger();

  public JobLifecycleManager(
      DiscoveryApi api,
      AccountTracker accounts,
      CostEstimator estimator,
      AnalysisRequestValidator validator,
      PollBackoff pollBackoff,
      Clock clock,
      Duration jobTtl) {
    this.api = api;
    this.accounts = accounts;
    this.estimator = estimator;
    this.validator = validator;
    this.pollBackoff = pollBackoff;
    this.clock = clock;
    this.jobTtl = jobTtl;
    Ticker ticker = ClockTicker.of(clock);
    this.jobs =
        Caffeine.newBuilder()
            .expireAfterAccess(jobTtl)
            .ticker(ticker)
            .executor(Runnable::run)
            .scheduler(Scheduler.systemScheduler())
            .evictionListener((String runId, Job job, RemovalCause cause) -> onEvicted(job, cause))
            .build();
    this.submissions =
        Caffeine.newBuilder()
            .expireAfterAccess(jobTtl)
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  /**
   * Validate, check affordability, upload and create the run. Returns as soon as the service has
   * issued a run id.
   *
   * @throws ValidationException for malformed requests, before any network call
   * @throws InsufficientCreditsException when a private run costs more than the known balance
   */
  public SubmissionReceipt submit(String apiKey, AnalysisRequest request) {
    DatasetFile dataset = validator.validate(request);
    CostEstimate estimate =
        estimator.estimateForBytes(dataset.sizeBytes(), request.depth(), request.visibility());
    String token = tokenFor(request, dataset);

    CompletableFuture<Accepted> attempt = new CompletableFuture<>();
    CompletableFuture<Accepted> earlier = submissions.asMap().putIfAbsent(token, attempt);
    if (earlier != null) {
      Accepted accepted = await(earlier);
      log.info("Submission {} already accepted as run {}", shortToken(token), accepted.runId());
      return receipt(accepted, true);
    }

    try {
      Accepted accepted = performSubmission(apiKey, request, dataset, estimate, token);
      attempt.complete(accepted);
      return receipt(accepted, false);
    } catch (RuntimeException e) {
      // Let a later retry with the same token try again.
      submissions.asMap().remove(token, attempt);
      attempt.completeExceptionally(e);
      throw e;
    }
  }

  /**
   * One status check. Terminal jobs answer from memory. A run id this process has never seen is
   * adopted from the service's answer, so ids survive restarts on the caller's side.
   *
   * @throws JobNotFoundException if the service does not know a run id this process never saw
   */
  public JobStatusView poll(String apiKey, String runId) {
    requireRunId(runId);
    Instant now = clock.instant();
    Job job = jobs.getIfPresent(runId);
    if (job != null && job.status().isTerminal()) {
      return view(job);
    }

    RemoteRunStatus remote;
    try {
      remote = api.runStatus(apiKey, runId);
    } catch (JobNotFoundException e) {
      if (job == null) {
        throw e;
      }
      if (job.markExpired(
          "The service no longer knows this run; it was cleaned up before completion.")) {
        log.warn("Run {} disappeared from the service; marked expired", runId);
      }
      return view(job);
    }

    if (job == null) {
      Job adopted = Job.adopted(runId, now);
      Job raced = jobs.asMap().putIfAbsent(runId, adopted);
      job = raced == null ? adopted : raced;
      log.debug("Tracking run {} by id", runId);
    }

    Optional<JobStatus> next = JobStatus.fromRemote(remote.status());
    if (next.isEmpty()) {
      log.warn(
          "Run {} reported unrecognised status '{}'; keeping {}",
          runId,
          remote.status(),
          job.status());
      job.recordPoll(now);
    } else if (job.applyRemote(
        next.get(), remote.errorMessage(), remote.jobId(), remote.jobStatus(), now)) {
      log.info("Run {} is now {}", runId, next.get().wireName());
    }
    return view(job);
  }

  /**
   * Results of a completed run, verbatim. The job is forgotten afterwards.
   *
   * @throws InvalidStateException if the run is not {@link JobStatus#COMPLETED}; no network call
   *     is made for a run known locally
   */
  public JsonNode fetchResults(String apiKey, String runId) {
    requireRunId(runId);
    Job job = jobs.getIfPresent(runId);
    if (job == null) {
      poll(apiKey, runId);
      job = jobs.getIfPresent(runId);
      if (job == null) {
        throw new JobNotFoundException(runId);
      }
    }

    JobStatus status = job.status();
    if (status != JobStatus.COMPLETED) {
      throw new InvalidStateException(
          "Results are not available: run %s is %s.".formatted(runId, status.wireName())
              + (status.isTerminal() ? "" : " Keep polling discovery_status."),
          Map.of("run_id", runId, "status", status.wireName()));
    }

    JsonNode payload;
    try {
      payload = api.runResults(apiKey, runId);
    } catch (JobNotFoundException e) {
      // COMPLETED is terminal, so force the transition by replacing the record.
      Job expired = Job.adopted(runId, clock.instant());
      expired.markExpired("Results were removed from the service before retrieval.");
      jobs.put(runId, expired);
      throw new JobNotFoundException(
          "Run %s completed but its results are no longer available.".formatted(runId), e);
    }
    job.storeResult(payload);
    jobs.asMap().remove(runId, job);
    log.info("Results for run {} retrieved", runId);
    return payload;
  }

  /** Current local view of a run without any network call. */
  public Optional<JobStatusView> find(String runId) {
    Job job = runId == null ? null : jobs.policy().getIfPresentQuietly(runId);
    return Optional.ofNullable(job).map(this::view);
  }

  /**
   * Run pending expiry now and return how many jobs it evicted. Expiry also happens during normal
   * cache activity and on a background schedule.
   */
  public int evictAbandoned() {
    int before = abandoned.get();
    jobs.cleanUp();
    submissions.cleanUp();
    int evicted = abandoned.get() - before;
    if (evicted > 0) {
      log.debug("Evicted {} idle job(s)", evicted);
    }
    return evicted;
  }

  /** Number of runs currently held in memory. */
  public int trackedJobs() {
    return (int) jobs.estimatedSize();
  }

  private Accepted performSubmission(
      String apiKey,
      AnalysisRequest request,
      DatasetFile dataset,
      CostEstimate estimate,
      String token) {
    if (!request.visibility().isPublic() && !accounts.canAfford(apiKey, estimate.credits())) {
      long balance = accounts.snapshot(apiKey).credits();
      throw new InsufficientCreditsException(balance, estimate.credits());
    }

    Job job = Job.submitting(clock.instant(), request.visibility(), estimate.credits(), token);
    log.info(
        "Submitting {} run on {} (target '{}', depth {}, ~{} credit(s))",
        request.visibility().wireName(),
        dataset.path().getFileName(),
        request.targetColumn(),
        request.depth(),
        estimate.credits());

    UploadedDataset uploaded = api.uploadDataset(apiKey, dataset.path(), dataset.format());
    if (request.numColumns() == null && uploaded.columnCount() > 0) {
      AnalysisRequestValidator.checkDepthAgainstColumns(request.depth(), uploaded.columnCount());
    }

    CreateRunResult created =
        api.createRun(
            apiKey,
            new RunSubmission(
                uploaded,
                request.targetColumn().trim(),
                request.depth(),
                request.visibility(),
                request.title(),
                request.description(),
                request.columnDescriptions(),
                token));

    job.accepted(created.runId());
    // An existing entry counts as accessed, which keeps it alive.
    jobs.asMap().putIfAbsent(created.runId(), job);
    if (!request.visibility().isPublic()) {
      accounts.invalidate(apiKey);
    }
    if (created.duplicate()) {
      log.info(
          "Service matched submission {} to existing run {}", shortToken(token), created.runId());
    } else {
      log.info("Run {} accepted", created.runId());
    }
    return new Accepted(created.runId(), estimate);
  }

  private String tokenFor(AnalysisRequest request, DatasetFile dataset) {
    if (request.idempotencyToken() != null && !request.idempotencyToken().isBlank()) {
      return request.idempotencyToken().trim();
    }
    String nonce = request.nonce();
    if (nonce == null || nonce.isBlank()) {
      // No nonce: every call is its own logical submission.
      nonce = UUID.randomUUID().toString();
    }
    return IdempotencyTokens.derive(request, dataset, nonce);
  }

  private SubmissionReceipt receipt(Accepted accepted, boolean duplicate) {
    Job job = jobs.getIfPresent(accepted.runId());
    JobStatus status = job == null ? JobStatus.QUEUED : job.status();
    int polls = job == null ? 0 : job.pollCount();
    return new SubmissionReceipt(
        accepted.runId(),
        status,
        accepted.estimate(),
        duplicate,
        pollBackoff.delayAfter(polls).toSeconds());
  }

  private void onEvicted(Job job, RemovalCause cause) {
    if (job == null || cause != RemovalCause.EXPIRED) {
      return;
    }
    abandoned.incrementAndGet();
    if (job.markExpired("Abandoned: not polled for " + jobTtl)) {
      log.info("Run {} abandoned by its caller; marked expired", job.runId());
    }
  }

  private JobStatusView view(Job job) {
    return job.view(pollBackoff.delayAfter(job.pollCount()).toSeconds());
  }

  private static Accepted await(CompletableFuture<Accepted> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    } catch (CancellationException e) {
      throw new InvalidStateException("Concurrent submission with the same token was cancelled.");
    }
  }

  private static void requireRunId(String runId) {
    if (runId == null || runId.isBlank()) {
      throw new ValidationException("run_id must not be empty.");
    }
  }

  private static String shortToken(String token) {
    return token.length() <= 18 ? token : token.substring(0, 18) + "…";
  }
}
