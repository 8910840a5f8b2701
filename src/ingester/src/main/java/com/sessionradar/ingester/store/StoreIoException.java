package com.sessionradar.ingester.store;

/** Raised when an ephemeral document cannot be written. */
public class StoreIoException extends RuntimeException {
  public StoreIoException(String message, Throwable cause) {
    super(message, cause);
  }
}
