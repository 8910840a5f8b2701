package com.sessionradar.ingester.session;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Timestamp helpers shared by the engine, the synchronizer and the durable store. */
public final class SessionTimes {
  private static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private SessionTimes() {}

  /** Formats with fixed millisecond precision so that derived session ids are stable. */
  public static String iso(Instant instant) {
    return ISO_MILLIS.format(instant);
  }

  public static Instant parse(String value) {
    return Instant.parse(value);
  }

  /**
   * Rounded session length in minutes, never below one.
   *
   * @param start session start
   * @param end last observation
   * @return {@code max(1, round((end - start) / 1min))}
   */
  public static int durationMinutes(Instant start, Instant end) {
    long millis = Duration.between(start, end).toMillis();
    return (int) Math.max(1L, Math.round(millis / 60_000.0));
  }

  /** Deterministic closed-session id: store id of the participant plus its start time. */
  public static String closedSessionId(ParticipantKey key, Instant start) {
    return key.storeId() + "-" + iso(start);
  }
}
