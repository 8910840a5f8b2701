package com.sessionradar.ingester.engine;

import com.sessionradar.ingester.async.BestEffortWriter;
import com.sessionradar.ingester.durable.DurableSessionStore;
import com.sessionradar.ingester.durable.DurableStoreException;
import com.sessionradar.ingester.roster.RosterNotifier;
import com.sessionradar.ingester.session.ClassifiedEntry;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.PseudoSessionRule;
import com.sessionradar.ingester.store.HistoryStore;
import com.sessionradar.ingester.store.SessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies one classified snapshot to the stores.
 *
 * <p>The reconciliation and the session/history writes happen synchronously on the caller's
 * thread. Durable checkpoints and roster updates are handed to the {@link BestEffortWriter} and
 * never awaited.
 */
@Component
public class SessionTracker {
  private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

  private final ReconciliationEngine engine;
  private final SessionStore sessionStore;
  private final HistoryStore historyStore;
  private final Optional<DurableSessionStore> durableStore;
  private final RosterNotifier roster;
  private final LastActiveCallsignResolver callsignResolver;
  private final PseudoSessionRule pseudoSessionRule;
  private final BestEffortWriter writer;
  private final Counter startedCounter;
  private final Counter closedCounter;
  private final AtomicInteger openGauge = new AtomicInteger(0);

  public SessionTracker(
      ReconciliationEngine engine,
      SessionStore sessionStore,
      HistoryStore historyStore,
      Optional<DurableSessionStore> durableStore,
      RosterNotifier roster,
      LastActiveCallsignResolver callsignResolver,
      PseudoSessionRule pseudoSessionRule,
      BestEffortWriter writer,
      MeterRegistry meterRegistry) {
    this.engine = engine;
    this.sessionStore = sessionStore;
    this.historyStore = historyStore;
    this.durableStore = durableStore;
    this.roster = roster;
    this.callsignResolver = callsignResolver;
    this.pseudoSessionRule = pseudoSessionRule;
    this.writer = writer;
    this.startedCounter = Counter.builder("ingester.sessions.started")
        .description("Open sessions created")
        .register(meterRegistry);
    this.closedCounter = Counter.builder("ingester.sessions.closed")
        .description("Sessions closed after exceeding the stale threshold")
        .register(meterRegistry);
    meterRegistry.gauge("ingester.sessions.open", openGauge);
    openGauge.set(sessionStore.size());
  }

  public ReconcileResult track(List<ClassifiedEntry> observed, Instant now) {
    ReconcileResult result = engine.reconcile(sessionStore.snapshot(), observed, now);

    if (!result.closed().isEmpty()) {
      historyStore.addAll(result.closed());
    }
    if (result.hasLifecycleChanges() || !result.refreshed().isEmpty() || sessionStore.isDirty()) {
      sessionStore.replaceAll(result.updatedOpen());
    }

    startedCounter.increment(result.started().size());
    closedCounter.increment(result.closed().size());
    openGauge.set(result.updatedOpen().size());

    durableStore.ifPresent(store -> checkpoint(store, result));
    notifyRoster(observed, result);
    return result;
  }

  private void checkpoint(DurableSessionStore store, ReconcileResult result) {
    for (ClosedSession session : result.closed()) {
      writer.submit("close " + session.id(), () -> {
        store.insertClosedSession(session);
        store.deleteOpenSession(session.key());
      });
    }
    List<OpenSession> live = new ArrayList<>(result.started());
    live.addAll(result.refreshed());
    if (!live.isEmpty()) {
      writer.submit("checkpoint " + live.size() + " open sessions", () -> {
        for (OpenSession session : live) {
          store.upsertOpenSession(session);
        }
      });
    }
  }

  private void notifyRoster(List<ClassifiedEntry> observed, ReconcileResult result) {
    // Pseudo positions must not become the member's last callsign; look up a real one instead.
    Map<Long, Optional<String>> pseudoMembers = new LinkedHashMap<>();
    for (OpenSession session : result.started()) {
      if (session.cid() > 0 && pseudoSessionRule.isPseudo(session.type(), session.callsign())) {
        pseudoMembers.put(session.cid(), callsignResolver.fromEphemeral(session.cid()));
      }
    }
    for (ClosedSession session : result.closed()) {
      if (session.cid() > 0 && !pseudoSessionRule.isCountable(session)) {
        pseudoMembers.put(session.cid(), callsignResolver.fromEphemeral(session.cid()));
      }
    }

    List<ClassifiedEntry> sightings = List.copyOf(observed);
    List<ClosedSession> closed = result.closed();
    if (sightings.isEmpty() && closed.isEmpty()) {
      return;
    }
    writer.submit("roster update", () -> {
      for (ClassifiedEntry entry : sightings) {
        roster.notifyObserved(entry.cid(), entry.name(), entry.key().callsign());
      }
      for (ClosedSession session : closed) {
        roster.recordClosedSession(session);
      }
      pseudoMembers.forEach((cid, ephemeral) -> resolveLastCallsign(cid, ephemeral));
      roster.flush();
    });
  }

  private void resolveLastCallsign(long cid, Optional<String> ephemeral) {
    Optional<String> callsign = ephemeral;
    if (callsign.isEmpty()) {
      try {
        callsign = callsignResolver.fromDurable(cid);
      } catch (DurableStoreException ex) {
        log.warn("Durable lookup of the last callsign for member {} failed: {}", cid, ex.getMessage());
      }
    }
    if (callsign.isPresent()) {
      roster.updateLastCallsign(cid, callsign.get());
    } else {
      log.debug("No non-pseudo callsign known for member {}, keeping the previous one", cid);
    }
  }
}
