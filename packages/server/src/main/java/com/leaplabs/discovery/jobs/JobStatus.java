package com.leaplabs.discovery.jobs;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of an analysis run. {@code SUBMITTING} exists only locally while the create-run call
 * is in flight; the rest mirror the service. {@code EXPIRED} means the run disappeared (or was
 * abandoned) and is deliberately distinct from {@code FAILED}, which is a computation failure
 * reported by the service.
 */
public enum JobStatus {
  SUBMITTING(0, false),
  QUEUED(1, false),
  RUNNING(2, false),
  COMPLETED(3, true),
  FAILED(3, true),
  EXPIRED(3, true);

  private final int rank;
  private final boolean terminal;

  JobStatus(int rank, boolean terminal) {
    this.rank = rank;
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /** True if moving from this status to {@code next} goes forward in the lifecycle. */
  boolean canAdvanceTo(JobStatus next) {
    return !terminal && next.rank > rank;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Map the service's status vocabulary. Unknown values yield empty. */
  public static Optional<JobStatus> fromRemote(String remote) {
    if (remote == null || remote.isBlank()) {
      return Optional.empty();
    }
    return switch (remote.trim().toLowerCase(Locale.ROOT)) {
      case "pending", "queued", "submitted", "created" -> Optional.of(QUEUED);
      case "processing", "running", "in_progress", "started" -> Optional.of(RUNNING);
      case "completed", "complete", "succeeded", "success", "done" -> Optional.of(COMPLETED);
      case "failed", "error", "errored", "cancelled", "canceled" -> Optional.of(FAILED);
      default -> Optional.empty();
    };
  }
}
