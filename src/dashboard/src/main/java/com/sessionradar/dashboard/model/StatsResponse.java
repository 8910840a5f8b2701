package com.sessionradar.dashboard.model;

import java.util.List;

/** Response payload for {@code GET /api/sessions/stats}. */
public record StatsResponse(
    String groupBy,
    String lastUpdated,
    StatsTotals totals,
    List<PeriodStatsItem> periods) {}
