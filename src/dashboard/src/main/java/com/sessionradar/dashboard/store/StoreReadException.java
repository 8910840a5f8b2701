package com.sessionradar.dashboard.store;

/** A document exists but could not be read or parsed. */
public class StoreReadException extends RuntimeException {
  public StoreReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
