package com.sessionradar.ingester.feed;

/** Raw pilot row; route and aircraft come from the optional flight plan. */
public record FeedPilot(
    String callsign,
    Long cid,
    String name,
    Double latitude,
    Double longitude,
    String departure,
    String arrival,
    String aircraft) {
}
