package com.sessionradar.ingester.roster;

import java.time.Instant;
import java.util.Map;

/** Persisted roster; members are keyed by their numeric id rendered as text. */
public record RosterDocument(Instant lastUpdated, Map<String, MemberActivity> members) {}
