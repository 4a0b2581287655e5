package com.leaplabs.discovery.client;

/**
 * Outcome of a create-run call. {@code duplicate} is true when the service recognised the
 * idempotency token and returned the run it had already accepted.
 */
public record CreateRunResult(String runId, boolean duplicate) {}
