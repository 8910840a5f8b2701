package com.sessionradar.ingester.store;

import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.SessionStats;
import java.time.Instant;
import java.util.List;

/** Persisted layout of the closed-session history, most recent first. */
public record HistoryDocument(Instant lastUpdated, List<ClosedSession> sessions, SessionStats stats) {}
