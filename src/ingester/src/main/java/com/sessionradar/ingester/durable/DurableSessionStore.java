package com.sessionradar.ingester.durable;

import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantKey;
import java.util.List;

/**
 * Long-term relational sink for closed sessions and open-session checkpoints.
 *
 * <p>Shared between processes: closed sessions are keyed by their deterministic id and inserted
 * with upsert-or-ignore semantics. Every operation may throw {@link DurableStoreException}.
 */
public interface DurableSessionStore {

  /** @return {@code true} when the row was new, {@code false} when the id already existed */
  boolean insertClosedSession(ClosedSession session);

  void upsertOpenSession(OpenSession session);

  void deleteOpenSession(ParticipantKey key);

  List<OpenSession> listOpenSessions();

  List<ClosedSession> listClosedSessions(ClosedSessionFilter filter);
}
