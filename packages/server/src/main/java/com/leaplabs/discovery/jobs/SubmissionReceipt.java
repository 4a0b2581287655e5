package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.estimate.CostEstimate;

/**
 * Result of {@link JobLifecycleManager#submit}. {@code duplicate} is true when the submission was
 * recognised as a retry of one already accepted, locally or by the service.
 */
public record SubmissionReceipt(
    String runId, JobStatus status, CostEstimate estimate, boolean duplicate, long nextPollSeconds) {}
