package com.sessionradar.ingester.store;

import com.sessionradar.ingester.session.OpenSession;
import java.time.Instant;
import java.util.Map;

/** Persisted layout of the open-session map, keyed by participant store id. */
public record SessionDocument(Instant lastUpdated, Map<String, OpenSession> sessions) {}
