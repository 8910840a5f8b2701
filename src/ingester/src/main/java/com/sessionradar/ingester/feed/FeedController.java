package com.sessionradar.ingester.feed;

/** Raw controller row as published by the feed; any field except the callsign may be absent. */
public record FeedController(
    String callsign,
    Long cid,
    String name,
    String frequency,
    Integer facility) {
}
