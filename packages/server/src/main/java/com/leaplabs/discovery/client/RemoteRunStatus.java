package com.leaplabs.discovery.client;

/** Status fields of a run as reported by the service; {@code status} is the raw wire value. */
public record RemoteRunStatus(
    String runId, String status, String jobId, String jobStatus, String errorMessage) {}
