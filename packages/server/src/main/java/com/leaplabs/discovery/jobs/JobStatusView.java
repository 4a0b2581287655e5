package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.estimate.Visibility;
import java.time.Instant;

/**
 * Immutable copy of a job's state handed to callers. {@code visibility} and {@code
 * estimatedCredits} are null for runs adopted by id; {@code nextPollSeconds} is null once terminal.
 */
public record JobStatusView(
    String runId,
    JobStatus status,
    Visibility visibility,
    Instant submittedAt,
    Instant lastPolledAt,
    int pollCount,
    Long estimatedCredits,
    Long creditsCharged,
    String failureReason,
    String remoteJobId,
    String remoteJobStatus,
    Long nextPollSeconds) {

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
