package com.leaplabs.discovery.exception;

import java.util.Map;

/** The service does not know the run id, and this process never saw it accepted either. */
public class JobNotFoundException extends DiscoveryException {
  public JobNotFoundException(String runId) {
    super(DiscoveryErrorCode.NOT_FOUND, "Run not found: " + runId, Map.of("run_id", runId));
  }

  public JobNotFoundException(String message, Throwable cause) {
    super(DiscoveryErrorCode.NOT_FOUND, message, cause);
  }
}
