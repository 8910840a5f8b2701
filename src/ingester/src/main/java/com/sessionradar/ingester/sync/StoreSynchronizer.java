package com.sessionradar.ingester.sync;

import com.sessionradar.ingester.durable.ClosedSessionFilter;
import com.sessionradar.ingester.durable.DurableSessionStore;
import com.sessionradar.ingester.durable.DurableStoreException;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantCategory;
import com.sessionradar.ingester.session.ParticipantKey;
import com.sessionradar.ingester.session.SessionTimes;
import com.sessionradar.ingester.store.HistoryStore;
import com.sessionradar.ingester.store.SessionStore;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot reconciliation between the durable store and the ephemeral stores.
 *
 * <p>Closed sessions are deduplicated by their derived id, so running the synchronizer any number
 * of times leaves history unchanged after the first run. History records missing from the durable
 * store are written back, which repairs best-effort writes that were lost.
 */
public class StoreSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(StoreSynchronizer.class);

  private final DurableSessionStore durableStore;
  private final HistoryStore historyStore;
  private final SessionStore sessionStore;

  public StoreSynchronizer(
      DurableSessionStore durableStore, HistoryStore historyStore, SessionStore sessionStore) {
    this.durableStore = durableStore;
    this.historyStore = historyStore;
    this.sessionStore = sessionStore;
  }

  /**
   * Runs all three passes.
   *
   * @throws DurableStoreException when the durable store cannot be read
   */
  public SyncReport synchronize() {
    List<ClosedSession> durableClosed = durableStore.listClosedSessions(ClosedSessionFilter.ALL);
    Map<ParticipantCategory, SyncReport.Counts> imported = importClosed(durableClosed);

    Set<String> durableIds = new HashSet<>();
    for (ClosedSession session : durableClosed) {
      durableIds.add(stableId(session));
    }
    int exported = exportMissing(durableIds);

    OpenCounts open = importOpen(durableStore.listOpenSessions());

    SyncReport report = new SyncReport(
        imported, open.created(), open.refreshed(), exported, historyStore.size(), sessionStore.size());
    log.info("Sync complete: controllers +{} (skipped {}), pilots +{} (skipped {}), "
            + "open created={} refreshed={}, exported={}, history={}, open={}",
        report.importedFor(ParticipantCategory.CONTROLLER).inserted(),
        report.importedFor(ParticipantCategory.CONTROLLER).skipped(),
        report.importedFor(ParticipantCategory.PILOT).inserted(),
        report.importedFor(ParticipantCategory.PILOT).skipped(),
        report.openCreated(),
        report.openRefreshed(),
        report.exported(),
        report.historySize(),
        report.openSize());
    return report;
  }

  private Map<ParticipantCategory, SyncReport.Counts> importClosed(List<ClosedSession> durableClosed) {
    Set<String> known = new HashSet<>(historyStore.ids());
    List<ClosedSession> candidates = new ArrayList<>();
    for (ClosedSession session : durableClosed) {
      String id = stableId(session);
      if (known.add(id)) {
        candidates.add(withId(session, id));
      }
    }
    Set<String> retained = new HashSet<>();
    if (!candidates.isEmpty()) {
      historyStore.addAll(candidates).forEach(s -> retained.add(s.id()));
    }
    if (retained.isEmpty()) {
      historyStore.recomputeStats();
    }

    // Rows already in history, duplicated in the batch or older than the retained window are skipped.
    Map<ParticipantCategory, SyncReport.Counts> counts = new EnumMap<>(ParticipantCategory.class);
    Set<String> counted = new HashSet<>();
    for (ClosedSession session : durableClosed) {
      String id = stableId(session);
      SyncReport.Counts current = counts.getOrDefault(session.type(), SyncReport.Counts.ZERO);
      boolean inserted = retained.contains(id) && counted.add(id);
      counts.put(session.type(), inserted ? current.plusInserted() : current.plusSkipped());
    }
    return counts;
  }

  private int exportMissing(Set<String> durableIds) {
    int exported = 0;
    for (ClosedSession session : historyStore.listAll()) {
      if (durableIds.contains(session.id())) {
        continue;
      }
      try {
        if (durableStore.insertClosedSession(session)) {
          exported++;
        }
      } catch (DurableStoreException ex) {
        log.warn("Unable to export closed session {}: {}", session.id(), ex.getMessage());
      }
    }
    return exported;
  }

  private OpenCounts importOpen(List<OpenSession> durableOpen) {
    Map<ParticipantKey, OpenSession> open = sessionStore.snapshot();
    int created = 0;
    int refreshed = 0;
    for (OpenSession checkpoint : durableOpen) {
      ParticipantKey key = checkpoint.key();
      OpenSession existing = open.get(key);
      if (existing == null) {
        open.put(key, checkpoint);
        created++;
      } else if (checkpoint.lastSeen().isAfter(existing.lastSeen())) {
        open.put(key, existing.withLastSeen(checkpoint.lastSeen()));
        refreshed++;
      }
    }
    if (created > 0 || refreshed > 0) {
      sessionStore.replaceAll(open);
    }
    return new OpenCounts(created, refreshed);
  }

  private record OpenCounts(int created, int refreshed) {}

  static String stableId(ClosedSession session) {
    return SessionTimes.closedSessionId(session.key(), session.startTime());
  }

  private static ClosedSession withId(ClosedSession session, String id) {
    if (id.equals(session.id())) {
      return session;
    }
    return new ClosedSession(id, session.type(), session.cid(), session.name(), session.callsign(),
        session.frequency(), session.facility(), session.departure(), session.arrival(),
        session.aircraft(), session.region(), session.startTime(), session.endTime(),
        session.durationMinutes(), session.date());
  }
}
