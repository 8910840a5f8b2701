package com.sessionradar.ingester.store;

import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantKey;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Currently-open sessions, held in memory and written through to the {@code sessions} document.
 *
 * <p>Owned by the reconciliation loop; callers other than the loop only read snapshots. When a
 * write fails the in-memory map stays authoritative and the next mutation rewrites the document.
 */
@Component
public class SessionStore {
  static final String DOCUMENT = "sessions";
  private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

  private final DocumentStore documents;
  private final Clock clock;
  private final Map<ParticipantKey, OpenSession> sessions = new LinkedHashMap<>();
  private volatile Instant lastUpdated;
  private volatile boolean dirty;

  public SessionStore(DocumentStore documents, Clock clock) {
    this.documents = documents;
    this.clock = clock;
  }

  /** Replaces the in-memory map with the persisted document, if there is one. */
  @PostConstruct
  public void loadFromDisk() {
    sessions.clear();
    Optional<SessionDocument> document = documents.read(DOCUMENT, SessionDocument.class);
    if (document.isEmpty()) {
      log.info("No persisted open sessions found in {}", documents.describe());
      return;
    }
    Map<String, OpenSession> persisted = document.get().sessions();
    if (persisted != null) {
      for (OpenSession session : persisted.values()) {
        if (!isUsable(session)) {
          log.warn("Ignoring unusable persisted open session: {}", session);
          continue;
        }
        sessions.put(session.key(), session);
      }
    }
    lastUpdated = document.get().lastUpdated();
    log.info("Loaded {} open sessions from {}", sessions.size(), documents.describe());
  }

  /** Writes the full map; returns {@code false} when the write failed and was deferred. */
  public boolean persistToDisk() {
    Instant now = clock.instant();
    Map<String, OpenSession> byId = new LinkedHashMap<>();
    for (OpenSession session : sessions.values()) {
      byId.put(session.id(), session);
    }
    try {
      documents.write(DOCUMENT, new SessionDocument(now, byId));
      lastUpdated = now;
      dirty = false;
      return true;
    } catch (StoreIoException ex) {
      dirty = true;
      log.warn("Open sessions not persisted, keeping in-memory state until the next write", ex);
      return false;
    }
  }

  public void upsert(OpenSession session) {
    sessions.put(session.key(), session);
    persistToDisk();
  }

  public void delete(ParticipantKey key) {
    if (sessions.remove(key) != null || dirty) {
      persistToDisk();
    }
  }

  /** Swaps in the state computed by one reconciliation cycle with a single document write. */
  public void replaceAll(Map<ParticipantKey, OpenSession> updated) {
    sessions.clear();
    sessions.putAll(updated);
    persistToDisk();
  }

  public Map<ParticipantKey, OpenSession> snapshot() {
    return new LinkedHashMap<>(sessions);
  }

  public List<OpenSession> listAll() {
    return new ArrayList<>(sessions.values());
  }

  public Optional<OpenSession> get(ParticipantKey key) {
    return Optional.ofNullable(sessions.get(key));
  }

  public int size() {
    return sessions.size();
  }

  public Instant lastUpdated() {
    return lastUpdated;
  }

  public boolean isDirty() {
    return dirty;
  }

  private static boolean isUsable(OpenSession session) {
    return session != null
        && session.type() != null
        && session.callsign() != null
        && !session.callsign().isBlank()
        && session.startTime() != null
        && session.lastSeen() != null;
  }
}
