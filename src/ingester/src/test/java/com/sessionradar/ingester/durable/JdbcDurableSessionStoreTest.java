package com.sessionradar.ingester.durable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sessionradar.ingester.TestFixtures;
import com.sessionradar.ingester.session.ClassifiedEntry;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantCategory;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcDurableSessionStoreTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir
  Path tempDir;

  private JdbcTemplate jdbcTemplate;
  private JdbcDurableSessionStore store;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("sessions.db"));
    dataSource.setDriverClassName("org.sqlite.JDBC");
    jdbcTemplate = new JdbcTemplate(dataSource);
    store = new JdbcDurableSessionStore(jdbcTemplate);
    store.initSchema();
  }

  @Test
  void closedSessionsAreInsertedOnceById() {
    ClosedSession session = TestFixtures.controllerSession("OPKC_TWR", 11, T0, T0.plusSeconds(5400));

    assertThat(store.insertClosedSession(session)).isTrue();
    assertThat(store.insertClosedSession(session)).isFalse();

    assertThat(store.listClosedSessions(ClosedSessionFilter.ALL)).containsExactly(session);
  }

  @Test
  void filterSelectsByMemberCategoryAndStart() {
    ClosedSession tower = TestFixtures.controllerSession("OPKC_TWR", 11, T0, T0.plusSeconds(600));
    ClosedSession approach = TestFixtures.controllerSession("OPKC_APP", 11, T0.plusSeconds(3600), T0.plusSeconds(7200));
    ClosedSession flight = TestFixtures.pilotSession("PIA301", 11, T0, T0.plusSeconds(9000));
    ClosedSession other = TestFixtures.controllerSession("OPLA_TWR", 12, T0, T0.plusSeconds(600));
    List.of(tower, approach, flight, other).forEach(store::insertClosedSession);

    assertThat(store.listClosedSessions(ClosedSessionFilter.forMember(11, ParticipantCategory.CONTROLLER)))
        .containsExactly(approach, tower);
    assertThat(store.listClosedSessions(new ClosedSessionFilter(null, null, T0.plusSeconds(1), null)))
        .containsExactly(approach);
    assertThat(store.listClosedSessions(new ClosedSessionFilter(null, null, null, 1)))
        .containsExactly(flight);
  }

  @Test
  void openSessionCheckpointsAreUpsertedByParticipant() {
    OpenSession started = OpenSession.start(
        ClassifiedEntry.pilot("PIA301", 7, "Ali", "OPKC", "OPLA", "A320", null), T0);
    store.upsertOpenSession(started);
    OpenSession refreshed = started.refresh(
        ClassifiedEntry.pilot("PIA301", 7, "Ali", "OPKC", "OPIS", "A320", null), T0.plusSeconds(60));
    store.upsertOpenSession(refreshed);

    assertThat(store.listOpenSessions()).containsExactly(refreshed);

    store.deleteOpenSession(refreshed.key());
    assertThat(store.listOpenSessions()).isEmpty();
  }

  @Test
  void newSessionReplacesACheckpointWhoseDeleteWasLost() {
    ClassifiedEntry tower = ClassifiedEntry.controller("OPKC_TWR", 11, "Jane", "118.300", "TWR", null);
    store.upsertOpenSession(OpenSession.start(tower, T0));
    Instant later = T0.plusSeconds(5 * 3600);
    OpenSession next = OpenSession.start(tower, later);

    store.upsertOpenSession(next);

    assertThat(store.listOpenSessions()).singleElement().satisfies(session -> {
      assertThat(session.startTime()).isEqualTo(later);
      assertThat(session.lastSeen()).isEqualTo(later);
    });
    assertThat(store.listOpenSessions()).containsExactly(next);
  }

  @Test
  void malformedRowsAreSkipped() {
    store.insertClosedSession(TestFixtures.pilotSession("PIA301", 7, T0, T0.plusSeconds(600)));
    jdbcTemplate.update("""
        INSERT INTO closed_sessions (id, type, cid, callsign, start_time, end_time, duration_minutes, session_date)
        VALUES ('bad', 'SATELLITE', 1, 'X', 'yesterday', 'today', 5, '2024-03-01')
        """);

    assertThat(store.listClosedSessions(ClosedSessionFilter.ALL))
        .extracting(ClosedSession::callsign)
        .containsExactly("PIA301");
  }

  @Test
  void unreachableDatabaseRaisesDurableStoreException() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("missing/dir/sessions.db"));
    dataSource.setDriverClassName("org.sqlite.JDBC");
    JdbcDurableSessionStore broken = new JdbcDurableSessionStore(new JdbcTemplate(dataSource));

    assertThatThrownBy(() -> broken.insertClosedSession(
            TestFixtures.pilotSession("PIA301", 7, T0, T0.plusSeconds(600))))
        .isInstanceOf(DurableWriteException.class);
    assertThatThrownBy(broken::listOpenSessions).isInstanceOf(DurableStoreException.class);
  }
}
