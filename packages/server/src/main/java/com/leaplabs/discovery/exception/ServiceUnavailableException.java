package com.leaplabs.discovery.exception;

import java.util.Map;

/** Transient failures persisted through every retry attempt. */
public class ServiceUnavailableException extends DiscoveryException {
  public ServiceUnavailableException(String message, int attempts, Throwable cause) {
    super(DiscoveryErrorCode.UNAVAILABLE, message, Map.of("attempts", attempts), cause);
  }
}
