package com.sessionradar.ingester.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.sessionradar.ingester.TestFixtures;
import com.sessionradar.ingester.async.BestEffortWriter;
import com.sessionradar.ingester.durable.ClosedSessionFilter;
import com.sessionradar.ingester.durable.DurableSessionStore;
import com.sessionradar.ingester.durable.DurableWriteException;
import com.sessionradar.ingester.roster.RosterNotifier;
import com.sessionradar.ingester.session.ClassifiedEntry;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.store.HistoryStore;
import com.sessionradar.ingester.store.InMemoryDocumentStore;
import com.sessionradar.ingester.store.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTrackerTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private InMemoryDocumentStore documents;
  private SessionStore sessionStore;
  private HistoryStore historyStore;
  private DurableSessionStore durableStore;
  private RosterNotifier roster;
  private SimpleMeterRegistry meterRegistry;
  private SessionTracker tracker;

  @BeforeEach
  void setUp() {
    documents = new InMemoryDocumentStore();
    Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    sessionStore = new SessionStore(documents, clock);
    historyStore = new HistoryStore(documents, TestFixtures.PSEUDO_RULE, 1000, clock);
    durableStore = mock(DurableSessionStore.class);
    roster = mock(RosterNotifier.class);
    meterRegistry = new SimpleMeterRegistry();
    tracker = newTracker(sessionStore);
  }

  @Test
  void staleSessionMovesToHistoryAndDurableStore() {
    ClassifiedEntry tower = ClassifiedEntry.controller("OPKC_TWR", 11, "Jane", "118.300", "TWR", "OPKR");

    tracker.track(List.of(tower), T0);
    tracker.track(List.of(tower), T0.plusSeconds(60));
    ReconcileResult result = tracker.track(List.of(), T0.plusSeconds(200));

    assertThat(result.closed()).hasSize(1);
    assertThat(sessionStore.size()).isZero();
    assertThat(historyStore.listAll()).containsExactlyElementsOf(result.closed());
    assertThat(historyStore.stats().totalControllerMinutes()).isEqualTo(1);

    ClosedSession closed = result.closed().get(0);
    verify(durableStore).insertClosedSession(closed);
    verify(durableStore).deleteOpenSession(closed.key());
    verify(roster).recordClosedSession(closed);
    assertThat(meterRegistry.counter("ingester.sessions.closed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("ingester.sessions.started").count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("ingester.sessions.open").gauge().value()).isZero();
  }

  @Test
  void openSessionsSurviveARestart() {
    tracker.track(List.of(ClassifiedEntry.pilot("PIA301", 7, "Ali", "OPKC", "OPLA", "A320", null)), T0);

    SessionStore restarted = new SessionStore(documents, Clock.systemUTC());
    restarted.loadFromDisk();
    ReconcileResult afterRestart = newTracker(restarted).track(
        List.of(ClassifiedEntry.pilot("PIA301", 7, "Ali", "OPKC", "OPLA", "A320", null)),
        T0.plusSeconds(15));

    assertThat(afterRestart.started()).isEmpty();
    assertThat(afterRestart.refreshed()).singleElement()
        .extracting(OpenSession::startTime)
        .isEqualTo(T0);
  }

  @Test
  void durableWriteFailureDoesNotFailTheCycle() {
    when(durableStore.insertClosedSession(any())).thenThrow(new DurableWriteException("down", null));
    ClassifiedEntry tower = ClassifiedEntry.controller("OPKC_TWR", 11, "Jane", "118.300", "TWR", "OPKR");

    tracker.track(List.of(tower), T0);
    ReconcileResult result = tracker.track(List.of(), T0.plusSeconds(130));

    assertThat(result.closed()).hasSize(1);
    assertThat(historyStore.size()).isEqualTo(1);
    assertThat(meterRegistry.counter("ingester.durable.writes.failed").count()).isEqualTo(1.0);
  }

  @Test
  void pseudoPositionDoesNotBecomeLastCallsign() {
    historyStore.addAll(List.of(
        TestFixtures.controllerSession("OPKC_APP", 11, T0.minusSeconds(7200), T0.minusSeconds(3600))));

    tracker.track(List.of(
        ClassifiedEntry.controller("OPKC_ATIS", 11, "Jane", "126.100", "TWR", "OPKR")), T0);

    verify(roster).updateLastCallsign(11, "OPKC_APP");
    verify(roster, never()).updateLastCallsign(anyLong(), eq("OPKC_ATIS"));
    verify(roster).notifyObserved(11, "Jane", "OPKC_ATIS");
    verify(roster).flush();
  }

  @Test
  void pseudoPositionFallsBackToDurableStore() {
    when(durableStore.listClosedSessions(any(ClosedSessionFilter.class))).thenReturn(List.of(
        TestFixtures.controllerSession("OPKC_ATIS", 11, T0.minusSeconds(3600), T0.minusSeconds(1800)),
        TestFixtures.controllerSession("OPKC_TWR", 11, T0.minusSeconds(7200), T0.minusSeconds(3600))));

    tracker.track(List.of(
        ClassifiedEntry.controller("OPKC_ATIS", 11, "Jane", "126.100", "TWR", "OPKR")), T0);

    verify(roster).updateLastCallsign(11, "OPKC_TWR");
  }

  @Test
  void rosterFailureIsContained() {
    doThrow(new IllegalStateException("roster offline")).when(roster).notifyObserved(anyLong(), any(), any());

    ReconcileResult result = tracker.track(List.of(
        ClassifiedEntry.pilot("PIA301", 7, "Ali", "OPKC", "OPLA", "A320", null)), T0);

    assertThat(result.started()).hasSize(1);
    assertThat(sessionStore.size()).isEqualTo(1);
  }

  private SessionTracker newTracker(SessionStore store) {
    LastActiveCallsignResolver resolver = new LastActiveCallsignResolver(
        store, historyStore, Optional.of(durableStore), TestFixtures.PSEUDO_RULE);
    return new SessionTracker(
        new ReconciliationEngine(Duration.ofSeconds(120)),
        store,
        historyStore,
        Optional.of(durableStore),
        roster,
        resolver,
        TestFixtures.PSEUDO_RULE,
        new BestEffortWriter(Runnable::run, meterRegistry),
        meterRegistry);
  }
}
