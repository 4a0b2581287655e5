package com.leaplabs.discovery.exception;

/** Local I/O failed (reading the dataset file, classpath resources). */
public class IoException extends DiscoveryException {
  public IoException(String message, Throwable cause) {
    super(DiscoveryErrorCode.IO_ERROR, message, cause);
  }
}
