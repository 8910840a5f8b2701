package com.sessionradar.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * One session as written by the ingester, open or closed.
 *
 * <p>Open sessions carry {@code lastSeen}; closed ones carry {@code endTime},
 * {@code durationMinutes} and {@code date}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
    String id,
    String type,
    Long cid,
    String name,
    String callsign,
    String frequency,
    String facility,
    String departure,
    String arrival,
    String aircraft,
    String region,
    Instant startTime,
    Instant lastSeen,
    Instant endTime,
    Integer durationMinutes,
    LocalDate date) {

  public static final String CONTROLLER = "controller";
  public static final String PILOT = "pilot";

  /** Grouping date: the stored {@code date}, else the UTC date of {@code startTime}. */
  public LocalDate periodDate() {
    if (date != null) {
      return date;
    }
    return startTime == null ? null : startTime.atZone(ZoneOffset.UTC).toLocalDate();
  }

  public int minutes() {
    return durationMinutes == null ? 0 : Math.max(0, durationMinutes);
  }
}
