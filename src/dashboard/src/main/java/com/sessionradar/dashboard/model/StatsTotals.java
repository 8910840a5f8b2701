package com.sessionradar.dashboard.model;

/** Countable totals over the whole history. */
public record StatsTotals(
    long controllerMinutes,
    String controllerHours,
    long controllerSessions,
    long pilotMinutes,
    String pilotHours,
    long pilotSessions) {}
