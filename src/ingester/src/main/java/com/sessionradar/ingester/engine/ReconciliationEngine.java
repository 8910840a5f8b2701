package com.sessionradar.ingester.engine;

import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.session.ClassifiedEntry;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Presence state machine: {@code ABSENT -> OPEN -> OPEN (refresh) -> CLOSED}.
 *
 * <p>{@link #reconcile} is a pure function of its arguments. Every closure in a cycle is derived
 * from the same {@code now} and the same observed snapshot; an open session that is missing from
 * the snapshot stays untouched until it has been unseen for longer than the stale threshold.
 */
@Component
public class ReconciliationEngine {
  private final Duration staleThreshold;

  @Autowired
  public ReconciliationEngine(IngesterProperties properties) {
    this(Duration.ofMillis(properties.tracking().staleThresholdMs()));
  }

  public ReconciliationEngine(Duration staleThreshold) {
    if (staleThreshold.isNegative()) {
      throw new IllegalArgumentException("stale threshold must not be negative");
    }
    this.staleThreshold = staleThreshold;
  }

  public Duration staleThreshold() {
    return staleThreshold;
  }

  /**
   * Reconciles the previous open state with one classified snapshot.
   *
   * @param previousOpen open sessions before this cycle (not modified)
   * @param observed classified snapshot rows; duplicates of one participant collapse to the last
   * @param now timestamp of the snapshot
   * @return new open state plus started, refreshed and closed sessions
   */
  public ReconcileResult reconcile(
      Map<ParticipantKey, OpenSession> previousOpen, List<ClassifiedEntry> observed, Instant now) {
    Map<ParticipantKey, ClassifiedEntry> seen = new LinkedHashMap<>();
    for (ClassifiedEntry entry : observed) {
      seen.put(entry.key(), entry);
    }

    Map<ParticipantKey, OpenSession> updated = new LinkedHashMap<>(previousOpen);
    List<OpenSession> started = new ArrayList<>();
    List<OpenSession> refreshed = new ArrayList<>();
    List<ClosedSession> closed = new ArrayList<>();

    for (Map.Entry<ParticipantKey, ClassifiedEntry> sighting : seen.entrySet()) {
      OpenSession existing = updated.get(sighting.getKey());
      if (existing == null) {
        OpenSession session = OpenSession.start(sighting.getValue(), now);
        updated.put(sighting.getKey(), session);
        started.add(session);
      } else {
        OpenSession session = existing.refresh(sighting.getValue(), now);
        updated.put(sighting.getKey(), session);
        refreshed.add(session);
      }
    }

    for (Map.Entry<ParticipantKey, OpenSession> open : previousOpen.entrySet()) {
      if (seen.containsKey(open.getKey())) {
        continue;
      }
      if (isStale(open.getValue(), now)) {
        closed.add(open.getValue().close());
        updated.remove(open.getKey());
      }
    }

    return new ReconcileResult(
        Collections.unmodifiableMap(updated),
        List.copyOf(started),
        List.copyOf(refreshed),
        List.copyOf(closed));
  }

  boolean isStale(OpenSession session, Instant now) {
    return Duration.between(session.lastSeen(), now).compareTo(staleThreshold) > 0;
  }
}
