package com.sessionradar.ingester.feed;

/** The snapshot could not be obtained; the current cycle must be treated as "no information". */
public class FeedUnavailableException extends RuntimeException {
  public FeedUnavailableException(String message) {
    super(message);
  }

  public FeedUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
