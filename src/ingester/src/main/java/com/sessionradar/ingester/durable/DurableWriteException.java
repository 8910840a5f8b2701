package com.sessionradar.ingester.durable;

public class DurableWriteException extends DurableStoreException {
  public DurableWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
