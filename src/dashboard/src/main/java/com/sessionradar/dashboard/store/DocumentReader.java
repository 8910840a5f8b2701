package com.sessionradar.dashboard.store;

import java.util.Optional;

/**
 * Read side of the ingester's document storage.
 *
 * <p>A document that was never written reads as empty. Backend failures surface as
 * {@link StoreReadException} or Spring's {@code DataAccessException}.
 */
public interface DocumentReader {
  String SESSIONS = "sessions";
  String HISTORY = "history";

  <T> Optional<T> read(String name, Class<T> type);

  String describe();
}
