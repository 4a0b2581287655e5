package com.leaplabs.discovery.exception;

import java.util.Map;

/** Malformed request: bad depth, unsupported format, oversized file, empty target column. */
public class ValidationException extends DiscoveryException {
  public ValidationException(String message) {
    super(DiscoveryErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(DiscoveryErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Throwable cause) {
    super(DiscoveryErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
