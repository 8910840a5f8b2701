package com.sessionradar.ingester.backfill;

/** One historical controller connection; timestamps are kept as published. */
public record AtcHistoryItem(String callsign, Long cid, String start, String end) {}
