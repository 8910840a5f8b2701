package com.sessionradar.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

/** Ingester document {@code history}: closed sessions, most recent first. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryDocument(Instant lastUpdated, List<SessionRecord> sessions) {

  public List<SessionRecord> sessionsOrEmpty() {
    return sessions == null ? List.of() : sessions;
  }
}
