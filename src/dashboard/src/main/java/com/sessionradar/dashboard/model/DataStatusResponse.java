package com.sessionradar.dashboard.model;

/** Response payload for {@code GET /api/status}. */
public record DataStatusResponse(
    String backend,
    int openSessions,
    int historySessions,
    long countableControllerSessions,
    long countablePilotSessions,
    String sessionsLastUpdated,
    String historyLastUpdated,
    boolean stale) {}
