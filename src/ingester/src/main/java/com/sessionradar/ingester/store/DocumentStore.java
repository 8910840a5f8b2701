package com.sessionradar.ingester.store;

import java.util.Optional;

/**
 * Durable-light persistence for the ephemeral JSON documents (open sessions, history, roster).
 *
 * <p>Each write replaces the whole document atomically.
 */
public interface DocumentStore {
  /**
   * Reads a named document.
   *
   * @param name document name, for example {@code sessions}
   * @param type target type
   * @return the document, or empty when it is absent or unreadable
   */
  <T> Optional<T> read(String name, Class<T> type);

  /**
   * Replaces a named document.
   *
   * @throws StoreIoException when the document cannot be serialized or written
   */
  void write(String name, Object document);

  /** Short label used in logs. */
  String describe();
}
