package com.sessionradar.ingester.store;

import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.PseudoSessionRule;
import com.sessionradar.ingester.session.SessionStats;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Retention-bounded list of closed sessions, most recent first, plus their totals.
 *
 * <p>After every mutation the list is re-sorted by end time, trimmed to the limit (oldest dropped)
 * and the totals are re-folded from the remaining records. Stored totals are never trusted on
 * load.
 */
@Component
public class HistoryStore {
  static final String DOCUMENT = "history";
  private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);
  private static final Comparator<ClosedSession> MOST_RECENT_FIRST =
      Comparator.comparing(ClosedSession::endTime)
          .thenComparing(ClosedSession::startTime)
          .reversed();

  private final DocumentStore documents;
  private final PseudoSessionRule pseudoSessionRule;
  private final int limit;
  private final Clock clock;
  private final List<ClosedSession> sessions = new ArrayList<>();
  private final Set<String> ids = new HashSet<>();
  private volatile SessionStats stats = SessionStats.EMPTY;
  private volatile Instant lastUpdated;

  @Autowired
  public HistoryStore(
      DocumentStore documents,
      PseudoSessionRule pseudoSessionRule,
      IngesterProperties properties,
      Clock clock) {
    this(documents, pseudoSessionRule, properties.tracking().historyLimit(), clock);
  }

  public HistoryStore(DocumentStore documents, PseudoSessionRule pseudoSessionRule, int limit, Clock clock) {
    if (limit <= 0) {
      throw new IllegalArgumentException("history limit must be positive");
    }
    this.documents = documents;
    this.pseudoSessionRule = pseudoSessionRule;
    this.limit = limit;
    this.clock = clock;
  }

  @PostConstruct
  public void loadFromDisk() {
    sessions.clear();
    ids.clear();
    Optional<HistoryDocument> document = documents.read(DOCUMENT, HistoryDocument.class);
    if (document.isPresent() && document.get().sessions() != null) {
      for (ClosedSession session : document.get().sessions()) {
        if (!isUsable(session)) {
          log.warn("Ignoring unusable persisted closed session: {}", session);
          continue;
        }
        if (!ids.add(session.id())) {
          continue;
        }
        sessions.add(session);
      }
      lastUpdated = document.get().lastUpdated();
    }
    normalize();
    log.info("Loaded {} closed sessions from {}", sessions.size(), documents.describe());
  }

  public boolean persistToDisk() {
    Instant now = clock.instant();
    try {
      documents.write(DOCUMENT, new HistoryDocument(now, List.copyOf(sessions), stats));
      lastUpdated = now;
      return true;
    } catch (StoreIoException ex) {
      log.warn("History not persisted, keeping in-memory state until the next write", ex);
      return false;
    }
  }

  /**
   * Adds sessions whose id is not yet present, then re-sorts, trims, re-folds and persists.
   *
   * @return the added sessions that are still retained after trimming to the limit
   */
  public List<ClosedSession> addAll(Collection<ClosedSession> closed) {
    List<ClosedSession> added = new ArrayList<>();
    for (ClosedSession session : closed) {
      if (ids.add(session.id())) {
        sessions.add(session);
        added.add(session);
      }
    }
    if (added.isEmpty()) {
      return List.of();
    }
    normalize();
    List<ClosedSession> retained = added.stream().filter(s -> ids.contains(s.id())).toList();
    if (!retained.isEmpty()) {
      persistToDisk();
    }
    return retained;
  }

  /** Re-derives the totals from the records; safe to call any number of times. */
  public SessionStats recomputeStats() {
    stats = SessionStats.fold(sessions, pseudoSessionRule);
    return stats;
  }

  public boolean contains(String id) {
    return ids.contains(id);
  }

  public Set<String> ids() {
    return Set.copyOf(ids);
  }

  public List<ClosedSession> listAll() {
    return List.copyOf(sessions);
  }

  public List<ClosedSession> recent(int max) {
    return List.copyOf(sessions.subList(0, Math.min(Math.max(0, max), sessions.size())));
  }

  /** First match in most-recent-first order. */
  public Optional<ClosedSession> findLatest(Predicate<ClosedSession> predicate) {
    return sessions.stream().filter(predicate).findFirst();
  }

  public SessionStats stats() {
    return stats;
  }

  public int size() {
    return sessions.size();
  }

  public Instant lastUpdated() {
    return lastUpdated;
  }

  private static boolean isUsable(ClosedSession session) {
    return session != null
        && session.id() != null
        && session.type() != null
        && session.callsign() != null
        && session.startTime() != null
        && session.endTime() != null;
  }

  private void normalize() {
    sessions.sort(MOST_RECENT_FIRST);
    while (sessions.size() > limit) {
      ClosedSession dropped = sessions.remove(sessions.size() - 1);
      ids.remove(dropped.id());
    }
    recomputeStats();
  }
}
