package com.sessionradar.ingester.session;

import java.util.Collection;

/**
 * Denormalized totals stored next to the history list.
 *
 * <p>Always produced by {@link #fold}, never incremented in place, so the totals cannot drift
 * from the records they summarize.
 */
public record SessionStats(
    long totalControllerMinutes,
    long totalPilotMinutes,
    long totalControllerSessions,
    long totalPilotSessions) {

  public static final SessionStats EMPTY = new SessionStats(0, 0, 0, 0);

  public static SessionStats fold(Collection<ClosedSession> sessions, PseudoSessionRule rule) {
    long controllerMinutes = 0;
    long pilotMinutes = 0;
    long controllerSessions = 0;
    long pilotSessions = 0;
    for (ClosedSession session : sessions) {
      if (!rule.isCountable(session)) {
        continue;
      }
      if (session.type() == ParticipantCategory.CONTROLLER) {
        controllerMinutes += session.durationMinutes();
        controllerSessions++;
      } else {
        pilotMinutes += session.durationMinutes();
        pilotSessions++;
      }
    }
    return new SessionStats(controllerMinutes, pilotMinutes, controllerSessions, pilotSessions);
  }
}
