package com.leaplabs.discovery.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** Structured error information handed back to MCP callers and written to logs. */
public final class ErrorDetails {
  @JsonProperty("error")
  public final String message;

  public final DiscoveryErrorCode code;
  public final String type;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      DiscoveryErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp;
  }
}
