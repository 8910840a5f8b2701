package com.sessionradar.dashboard.model;

/**
 * Countable activity within one period bucket.
 *
 * @param period {@code yyyy-MM-dd} for day and week (week start), {@code yyyy-MM}, or {@code yyyy}
 */
public record PeriodStats(
    String period,
    long controllerMinutes,
    long controllerSessions,
    long pilotMinutes,
    long pilotSessions) {}
