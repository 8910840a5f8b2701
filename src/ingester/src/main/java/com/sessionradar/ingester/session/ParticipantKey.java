package com.sessionradar.ingester.session;

import java.util.Objects;

/**
 * Identity of a tracked participant.
 *
 * <p>The numeric member id is deliberately not part of the key: two rows with the same category
 * and callsign are the same participant even when the id is missing from one of them.
 *
 * @param category participant category
 * @param callsign callsign as published by the feed
 */
public record ParticipantKey(ParticipantCategory category, String callsign) {
  public ParticipantKey {
    Objects.requireNonNull(category, "category");
    if (callsign == null || callsign.isBlank()) {
      throw new IllegalArgumentException("callsign must not be blank");
    }
    callsign = callsign.trim();
  }

  /** Key used in the open-session document, for example {@code atc-OPKR_CTR}. */
  public String storeId() {
    return category.idPrefix() + "-" + callsign;
  }
}
