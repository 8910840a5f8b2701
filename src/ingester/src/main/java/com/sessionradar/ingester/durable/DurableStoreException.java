package com.sessionradar.ingester.durable;

/** The durable store could not be reached or rejected an operation. */
public class DurableStoreException extends RuntimeException {
  public DurableStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
