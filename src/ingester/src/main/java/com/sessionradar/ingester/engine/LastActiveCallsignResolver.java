package com.sessionradar.ingester.engine;

import com.sessionradar.ingester.durable.ClosedSessionFilter;
import com.sessionradar.ingester.durable.DurableSessionStore;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantCategory;
import com.sessionradar.ingester.session.PseudoSessionRule;
import com.sessionradar.ingester.store.HistoryStore;
import com.sessionradar.ingester.store.SessionStore;
import java.util.Comparator;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Finds the most recent non-pseudo controller callsign of a member.
 *
 * <p>Search order is session store, history store, durable store; the first hit wins. The
 * ephemeral lookups are cheap and run on the reconciliation thread, the durable lookup is meant
 * to run on the best-effort writer.
 */
@Component
public class LastActiveCallsignResolver {
  private final SessionStore sessionStore;
  private final HistoryStore historyStore;
  private final Optional<DurableSessionStore> durableStore;
  private final PseudoSessionRule pseudoSessionRule;

  public LastActiveCallsignResolver(
      SessionStore sessionStore,
      HistoryStore historyStore,
      Optional<DurableSessionStore> durableStore,
      PseudoSessionRule pseudoSessionRule) {
    this.sessionStore = sessionStore;
    this.historyStore = historyStore;
    this.durableStore = durableStore;
    this.pseudoSessionRule = pseudoSessionRule;
  }

  public Optional<String> fromEphemeral(long cid) {
    Optional<String> open = sessionStore.listAll().stream()
        .filter(session -> session.cid() == cid)
        .filter(session -> session.type() == ParticipantCategory.CONTROLLER)
        .filter(session -> !pseudoSessionRule.isPseudo(session.type(), session.callsign()))
        .max(Comparator.comparing(OpenSession::lastSeen))
        .map(OpenSession::callsign);
    if (open.isPresent()) {
      return open;
    }
    return historyStore.findLatest(session -> session.cid() == cid
            && session.type() == ParticipantCategory.CONTROLLER
            && pseudoSessionRule.isCountable(session))
        .map(ClosedSession::callsign);
  }

  /** May throw {@code DurableStoreException}. */
  public Optional<String> fromDurable(long cid) {
    if (durableStore.isEmpty()) {
      return Optional.empty();
    }
    return durableStore.get()
        .listClosedSessions(ClosedSessionFilter.forMember(cid, ParticipantCategory.CONTROLLER))
        .stream()
        .filter(pseudoSessionRule::isCountable)
        .findFirst()
        .map(ClosedSession::callsign);
  }

  public boolean hasDurableStore() {
    return durableStore.isPresent();
  }
}
