package com.leaplabs.discovery.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends DiscoveryException {
  public SerializationException(String message) {
    super(DiscoveryErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(DiscoveryErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
