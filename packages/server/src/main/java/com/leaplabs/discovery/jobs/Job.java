package com.leaplabs.discovery.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaplabs.discovery.estimate.Visibility;
import java.time.Instant;

/**
 * In-memory state of one run. Package-private: only {@link JobLifecycleManager} mutates it, and
 * callers see immutable {@link JobStatusView}s. All mutable fields are guarded by the instance
 * monitor.
 */
final class Job {
  final Instant submittedAt;
  final Visibility visibility;
  final Long estimatedCredits;
  final String idempotencyToken;

  private String runId;
  private JobStatus status;
  private Long creditsCharged;
  private String failureReason;
  private String remoteJobId;
  private String remoteJobStatus;
  private Instant lastPolledAt;
  private int pollCount;
  private JsonNode resultPayload;

  private Job(
      String runId,
      JobStatus status,
      Instant submittedAt,
      Visibility visibility,
      Long estimatedCredits,
      String idempotencyToken) {
    this.runId = runId;
    this.status = status;
    this.submittedAt = submittedAt;
    this.visibility = visibility;
    this.estimatedCredits = estimatedCredits;
    this.idempotencyToken = idempotencyToken;
    this.creditsCharged = visibility != null && visibility.isPublic() ? 0L : null;
  }

  /** A submission that has not been acknowledged by the service yet. */
  static Job submitting(
      Instant now, Visibility visibility, long estimatedCredits, String idempotencyToken) {
    return new Job(null, JobStatus.SUBMITTING, now, visibility, estimatedCredits, idempotencyToken);
  }

  /** A run this process did not submit, known only through its run id. */
  static Job adopted(String runId, Instant now) {
    return new Job(runId, JobStatus.QUEUED, now, null, null, null);
  }

  synchronized void accepted(String runId) {
    this.runId = runId;
    if (status == JobStatus.SUBMITTING) {
      status = JobStatus.QUEUED;
    }
  }

  /**
   * Record a poll result. Transitions only move forward; a stale or out-of-order remote status is
   * ignored. Returns true when the status changed.
   */
  synchronized boolean applyRemote(
      JobStatus next, String reason, String jobId, String jobStatus, Instant now) {
    recordPoll(now);
    if (jobId != null) remoteJobId = jobId;
    if (jobStatus != null) remoteJobStatus = jobStatus;
    if (!status.canAdvanceTo(next)) {
      return false;
    }
    status = next;
    if (next == JobStatus.FAILED) {
      failureReason = reason == null || reason.isBlank() ? "The service reported a failure." : reason;
    }
    return true;
  }

  synchronized void recordPoll(Instant now) {
    pollCount++;
    lastPolledAt = now;
  }

  synchronized boolean markExpired(String reason) {
    if (status.isTerminal()) {
      return false;
    }
    status = JobStatus.EXPIRED;
    failureReason = reason;
    return true;
  }

  synchronized void storeResult(JsonNode payload) {
    resultPayload = payload;
    for (String field : new String[] {"credits_charged", "credits_used"}) {
      if (payload.path(field).isNumber()) {
        creditsCharged = payload.path(field).asLong();
        break;
      }
    }
  }

  synchronized String runId() {
    return runId;
  }

  synchronized JobStatus status() {
    return status;
  }

  synchronized int pollCount() {
    return pollCount;
  }

  synchronized JsonNode resultPayload() {
    return resultPayload;
  }

  synchronized JobStatusView view(Long nextPollSeconds) {
    return new JobStatusView(
        runId,
        status,
        visibility,
        submittedAt,
        lastPolledAt,
        pollCount,
        estimatedCredits,
        creditsCharged,
        failureReason,
        remoteJobId,
        remoteJobStatus,
        status.isTerminal() ? null : nextPollSeconds);
  }
}
