package com.sessionradar.ingester.roster;

import com.sessionradar.ingester.session.ClosedSession;

/**
 * Member enrichment collaborator. Calls are best-effort: nothing the tracker does depends on
 * their outcome.
 */
public interface RosterNotifier {

  void notifyObserved(long cid, String name, String callsign);

  void recordClosedSession(ClosedSession session);

  /** Sets the member's last active callsign, unless it is a pseudo-session callsign. */
  void updateLastCallsign(long cid, String callsign);

  /** Persists changes accumulated by the calls above. */
  default void flush() {
  }
}
