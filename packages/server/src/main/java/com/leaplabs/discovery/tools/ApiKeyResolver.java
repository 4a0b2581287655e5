package com.leaplabs.discovery.tools;

import com.leaplabs.discovery.exception.AuthenticationException;

/**
 * Picks the API key for a call: the explicit tool argument first, then the configured default
 * (normally {@code DISCOVERY_API_KEY}), so keys need not travel through tool arguments.
 */
public class ApiKeyResolver {
  private final String defaultApiKey;

  public ApiKeyResolver(String defaultApiKey) {
    this.defaultApiKey = blankToNull(defaultApiKey);
  }

  public String resolve(String explicit) {
    String key = blankToNull(explicit);
    return key != null ? key : defaultApiKey;
  }

  public String require(String explicit) {
    String key = resolve(explicit);
    if (key == null) {
      throw new AuthenticationException(
          "API key required. Pass api_key or set DISCOVERY_API_KEY env var.");
    }
    return key;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
