package com.sessionradar.ingester.engine;

import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantKey;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param updatedOpen open sessions after the cycle, keyed by participant
 * @param started sessions first seen in this cycle
 * @param refreshed sessions that were already open and seen again
 * @param closed sessions evicted because they exceeded the stale threshold
 */
public record ReconcileResult(
    Map<ParticipantKey, OpenSession> updatedOpen,
    List<OpenSession> started,
    List<OpenSession> refreshed,
    List<ClosedSession> closed) {

  public boolean hasLifecycleChanges() {
    return !started.isEmpty() || !closed.isEmpty();
  }
}
