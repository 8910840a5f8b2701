package com.sessionradar.ingester.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Finished session as kept in the history document and the durable store.
 *
 * @param id deterministic id ({@code <storeId>-<startTime>}) used for deduplication
 * @param date UTC start date used for period grouping
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClosedSession(
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
    Instant endTime,
    int durationMinutes,
    LocalDate date) {

  public ClosedSession {
    if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
      endTime = startTime;
    }
    durationMinutes = Math.max(1, durationMinutes);
    if (date == null && startTime != null) {
      date = startTime.atZone(ZoneOffset.UTC).toLocalDate();
    }
  }

  /** Builds a record whose id and duration are derived from identity and times. */
  public static ClosedSession of(
      ParticipantKey key,
      long cid,
      String name,
      String frequency,
      String facility,
      String departure,
      String arrival,
      String aircraft,
      String region,
      Instant start,
      Instant end) {
    return new ClosedSession(
        SessionTimes.closedSessionId(key, start),
        key.category(),
        cid,
        name,
        key.callsign(),
        frequency,
        facility,
        departure,
        arrival,
        aircraft,
        region,
        start,
        end,
        SessionTimes.durationMinutes(start, end),
        null);
  }

  @JsonIgnore
  public ParticipantKey key() {
    return new ParticipantKey(type, callsign);
  }
}
