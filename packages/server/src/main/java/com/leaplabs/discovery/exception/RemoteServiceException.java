package com.leaplabs.discovery.exception;

import java.util.Map;

/** Non-retryable error reported by the Discovery service (4xx other than auth and not-found). */
public class RemoteServiceException extends DiscoveryException {
  private final int httpStatus;

  public RemoteServiceException(DiscoveryErrorCode code, int httpStatus, String message) {
    super(code, message, Map.of("http_status", httpStatus));
    this.httpStatus = httpStatus;
  }

  public int getHttpStatus() {
    return httpStatus;
  }
}
