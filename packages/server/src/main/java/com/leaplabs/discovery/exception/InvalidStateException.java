package com.leaplabs.discovery.exception;

import java.util.Map;

/** Operation requested on a job whose current status does not allow it. */
public class InvalidStateException extends DiscoveryException {
  public InvalidStateException(String message) {
    super(DiscoveryErrorCode.FAILED_PRECONDITION, message);
  }

  public InvalidStateException(String message, Map<String, ?> context) {
    super(DiscoveryErrorCode.FAILED_PRECONDITION, message, context);
  }
}
