package com.leaplabs.discovery.exception;

/** Missing API key, or the service rejected the one supplied. */
public class AuthenticationException extends DiscoveryException {
  public AuthenticationException(String message) {
    super(DiscoveryErrorCode.UNAUTHENTICATED, message);
  }
}
