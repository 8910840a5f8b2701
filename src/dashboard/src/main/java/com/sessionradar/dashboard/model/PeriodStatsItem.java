package com.sessionradar.dashboard.model;

/** {@link PeriodStats} as rendered by the API, durations as {@code HHH:MM:SS}. */
public record PeriodStatsItem(
    String period,
    long controllerMinutes,
    String controllerHours,
    long controllerSessions,
    long pilotMinutes,
    String pilotHours,
    long pilotSessions) {}
