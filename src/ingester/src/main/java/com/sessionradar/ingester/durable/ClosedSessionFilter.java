package com.sessionradar.ingester.durable;

import com.sessionradar.ingester.session.ParticipantCategory;
import java.time.Instant;

/**
 * Optional criteria for {@link DurableSessionStore#listClosedSessions}; {@code null} fields match
 * everything.
 *
 * @param type only sessions of this category
 * @param cid only sessions of this member
 * @param startedOnOrAfter only sessions starting at or after this instant
 * @param limit max number of rows, most recent end time first
 */
public record ClosedSessionFilter(
    ParticipantCategory type, Long cid, Instant startedOnOrAfter, Integer limit) {

  public static final ClosedSessionFilter ALL = new ClosedSessionFilter(null, null, null, null);

  public static ClosedSessionFilter forMember(long cid, ParticipantCategory type) {
    return new ClosedSessionFilter(type, cid, null, null);
  }
}
