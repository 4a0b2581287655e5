package com.leaplabs.discovery.exception;

import java.util.Map;

/**
 * A single network exchange failed in a way that may succeed on retry (I/O error, timeout, 429,
 * 5xx). Retried by the transport; callers only see it wrapped in {@link
 * ServiceUnavailableException} once the retry budget is spent.
 */
public class TransientNetworkException extends DiscoveryException {
  public TransientNetworkException(String message) {
    super(DiscoveryErrorCode.UNAVAILABLE, message);
  }

  public TransientNetworkException(String message, Map<String, ?> context) {
    super(DiscoveryErrorCode.UNAVAILABLE, message, context);
  }

  public TransientNetworkException(String message, Throwable cause) {
    super(DiscoveryErrorCode.UNAVAILABLE, message, cause);
  }
}
