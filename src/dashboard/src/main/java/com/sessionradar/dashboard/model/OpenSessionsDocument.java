package com.sessionradar.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;

/** Ingester document {@code sessions}: open sessions keyed by participant id. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenSessionsDocument(Instant lastUpdated, Map<String, SessionRecord> sessions) {

  public Map<String, SessionRecord> sessionsOrEmpty() {
    return sessions == null ? Map.of() : sessions;
  }
}
