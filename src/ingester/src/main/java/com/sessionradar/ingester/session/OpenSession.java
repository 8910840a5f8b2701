package com.sessionradar.ingester.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * In-progress presence of one participant, as persisted in the open-session document.
 *
 * <p>Instances are immutable; the session store replaces them on every refresh.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenSession(
    String id,
    ParticipantCategory type,
    long cid,
    String name,
    String callsign,
    String frequency,
    String facility,
    String departure,
    String arrival,
    String aircraft,
    String region,
    Instant startTime,
    Instant lastSeen) {

  public OpenSession {
    if (startTime != null && lastSeen != null && lastSeen.isBefore(startTime)) {
      lastSeen = startTime;
    }
  }

  public static OpenSession start(ClassifiedEntry entry, Instant now) {
    ParticipantKey key = entry.key();
    return new OpenSession(
        key.storeId(),
        key.category(),
        entry.cid(),
        entry.name(),
        key.callsign(),
        entry.frequency(),
        entry.facility(),
        entry.departure(),
        entry.arrival(),
        entry.aircraft(),
        entry.region(),
        now,
        now);
  }

  @JsonIgnore
  public ParticipantKey key() {
    return new ParticipantKey(type, callsign);
  }

  /**
   * Applies a new sighting: {@code lastSeen} moves to {@code now}, mutable attributes follow the
   * feed and {@code startTime} is preserved. A missing member id does not erase a known one.
   */
  public OpenSession refresh(ClassifiedEntry entry, Instant now) {
    Instant seen = now.isAfter(lastSeen) ? now : lastSeen;
    return new OpenSession(
        id,
        type,
        entry.cid() > 0 ? entry.cid() : cid,
        entry.name(),
        callsign,
        entry.frequency(),
        entry.facility(),
        entry.departure(),
        entry.arrival(),
        entry.aircraft(),
        entry.region() != null ? entry.region() : region,
        startTime,
        seen);
  }

  /** Only refreshes liveness, used when the durable store reports a newer sighting. */
  public OpenSession withLastSeen(Instant seen) {
    if (!seen.isAfter(lastSeen)) {
      return this;
    }
    return new OpenSession(
        id, type, cid, name, callsign, frequency, facility, departure, arrival, aircraft, region,
        startTime, seen);
  }

  /** Converts this session into its history record; the session ends at its last sighting. */
  public ClosedSession close() {
    return new ClosedSession(
        SessionTimes.closedSessionId(key(), startTime),
        type,
        cid,
        name,
        callsign,
        frequency,
        facility,
        departure,
        arrival,
        aircraft,
        region,
        startTime,
        lastSeen,
        SessionTimes.durationMinutes(startTime, lastSeen),
        startTime.atZone(ZoneOffset.UTC).toLocalDate());
  }
}
