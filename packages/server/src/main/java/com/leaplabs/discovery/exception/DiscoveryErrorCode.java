package com.leaplabs.discovery.exception;

/**
 * Canonical error codes surfaced to MCP callers. Codes are stable and suitable for agents that
 * branch on them; prefer the most specific code that reflects the failure origin and
 * actionability.
 */
public enum DiscoveryErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,
  UNAUTHENTICATED,
  RESOURCE_EXHAUSTED,
  ABORTED,
  UNAVAILABLE,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
}
