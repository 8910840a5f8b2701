package com.sessionradar.ingester.session;

/**
 * Snapshot row accepted by the classifier.
 *
 * <p>Optional attributes are never null: absent values carry the {@link #NOT_AVAILABLE} or
 * {@link #UNKNOWN} sentinels. Controller-only fields are {@code null} on pilot entries and vice
 * versa.
 */
public record ClassifiedEntry(
    ParticipantKey key,
    long cid,
    String name,
    String frequency,
    String facility,
    String departure,
    String arrival,
    String aircraft,
    String region) {

  public static final String NOT_AVAILABLE = "N/A";
  public static final String UNKNOWN = "Unknown";

  public static ClassifiedEntry controller(
      String callsign, long cid, String name, String frequency, String facility, String region) {
    return new ClassifiedEntry(
        new ParticipantKey(ParticipantCategory.CONTROLLER, callsign),
        cid,
        name,
        frequency,
        facility,
        null,
        null,
        null,
        region);
  }

  public static ClassifiedEntry pilot(
      String callsign,
      long cid,
      String name,
      String departure,
      String arrival,
      String aircraft,
      String region) {
    return new ClassifiedEntry(
        new ParticipantKey(ParticipantCategory.PILOT, callsign),
        cid,
        name,
        null,
        null,
        departure,
        arrival,
        aircraft,
        region);
  }
}
