package com.sessionradar.dashboard.api;

/**
 * Domain-level exception used for request validation failures.
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
