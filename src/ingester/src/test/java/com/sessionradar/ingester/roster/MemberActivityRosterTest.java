package com.sessionradar.ingester.roster;

import static org.assertj.core.api.Assertions.assertThat;

import com.sessionradar.ingester.TestFixtures;
import com.sessionradar.ingester.store.InMemoryDocumentStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemberActivityRosterTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private InMemoryDocumentStore documents;
  private MemberActivityRoster roster;

  @BeforeEach
  void setUp() {
    documents = new InMemoryDocumentStore();
    roster = new MemberActivityRoster(documents, TestFixtures.PSEUDO_RULE, Clock.fixed(T0, ZoneOffset.UTC));
  }

  @Test
  void firstSightingAddsMemberAndNameIsOnlyUpgradedFromPlaceholders() {
    roster.notifyObserved(11, "Unknown", "OPKC_TWR");
    assertThat(roster.get(11)).get().extracting(MemberActivity::name).isNull();

    roster.notifyObserved(11, "Jane Doe", "OPKC_TWR");
    roster.notifyObserved(11, "Someone Else", "OPKC_TWR");

    MemberActivity member = roster.get(11).orElseThrow();
    assertThat(member.name()).isEqualTo("Jane Doe");
    assertThat(member.lastCallsign()).isEqualTo("OPKC_TWR");
    assertThat(member.addedAt()).isEqualTo(T0);
  }

  @Test
  void pseudoCallsignNeverBecomesLastCallsign() {
    roster.notifyObserved(11, "Jane", "OPKC_APP");
    roster.notifyObserved(11, "Jane", "OPKC_ATIS");
    roster.updateLastCallsign(11, "OPKC_ATIS");

    assertThat(roster.get(11).orElseThrow().lastCallsign()).isEqualTo("OPKC_APP");
  }

  @Test
  void closedSessionsAccumulateExceptPseudoOnes() {
    roster.recordClosedSession(TestFixtures.controllerSession("OPKC_TWR", 11, T0, T0.plusSeconds(3600)));
    roster.recordClosedSession(TestFixtures.controllerSession("OPKC_ATIS", 11, T0, T0.plusSeconds(3600)));
    roster.recordClosedSession(TestFixtures.pilotSession("PIA301", 11, T0, T0.plusSeconds(1800)));
    roster.recordClosedSession(TestFixtures.pilotSession("PIA302", 0, T0, T0.plusSeconds(1800)));

    MemberActivity member = roster.get(11).orElseThrow();
    assertThat(member.totalControllerMinutes()).isEqualTo(60);
    assertThat(member.totalPilotMinutes()).isEqualTo(30);
    assertThat(member.sessionsCount()).isEqualTo(2);
    assertThat(member.lastCallsign()).isEqualTo("OPKC_TWR");
    assertThat(roster.listAll()).hasSize(1);
  }

  @Test
  void closingAnOlderSessionKeepsTheCallsignOfALaterSighting() {
    MemberActivityRoster later = new MemberActivityRoster(
        documents, TestFixtures.PSEUDO_RULE, Clock.fixed(T0.plusSeconds(7200), ZoneOffset.UTC));
    later.notifyObserved(11, "Jane", "OPLA_APP");
    later.recordClosedSession(TestFixtures.controllerSession("OPKC_TWR", 11, T0, T0.plusSeconds(3600)));

    MemberActivity member = later.get(11).orElseThrow();
    assertThat(member.lastCallsign()).isEqualTo("OPLA_APP");
    assertThat(member.lastSeen()).isEqualTo(T0.plusSeconds(7200));
    assertThat(member.totalControllerMinutes()).isEqualTo(60);
    assertThat(member.sessionsCount()).isEqualTo(1);
  }

  @Test
  void flushPersistsOnlyWhenSomethingChanged() {
    roster.flush();
    assertThat(documents.writes()).isZero();

    roster.notifyObserved(11, "Jane", "OPKC_TWR");
    roster.flush();
    roster.flush();
    assertThat(documents.writes()).isEqualTo(1);

    MemberActivityRoster reloaded = new MemberActivityRoster(documents, TestFixtures.PSEUDO_RULE, Clock.systemUTC());
    reloaded.loadFromDisk();
    assertThat(reloaded.get(11)).isEqualTo(roster.get(11));
  }

  @Test
  void positionNamesAndIdsCountAsPlaceholders() {
    assertThat(MemberActivityRoster.isPlaceholder("TWR", 11)).isTrue();
    assertThat(MemberActivityRoster.isPlaceholder("11", 11)).isTrue();
    assertThat(MemberActivityRoster.isPlaceholder("Not Tracked", 11)).isTrue();
    assertThat(MemberActivityRoster.isPlaceholder("Jane", 11)).isFalse();
  }
}
