package com.sessionradar.dashboard.api;

import com.sessionradar.dashboard.store.StoreReadException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for dashboard API endpoints.
 *
 * <p>Known domain and backend exceptions are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps document store failures (Redis down, unreadable file) to HTTP 502.
   *
   * @param ex backend read failure
   * @return standardized error payload
   */
  @ExceptionHandler({DataAccessException.class, StoreReadException.class})
  public ResponseEntity<Map<String, Object>> handleStoreFailure(RuntimeException ex) {
    log.warn("Session store unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("backend_unavailable", "session store unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message,
        "timestamp", Instant.now().toString());
  }
}
