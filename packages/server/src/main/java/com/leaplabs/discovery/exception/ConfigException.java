package com.leaplabs.discovery.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends DiscoveryException {
  public ConfigException(String message) {
    super(DiscoveryErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DiscoveryErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
