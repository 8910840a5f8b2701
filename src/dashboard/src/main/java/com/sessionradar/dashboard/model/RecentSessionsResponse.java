package com.sessionradar.dashboard.model;

import java.util.List;

/** Response payload for {@code GET /api/sessions/recent}. */
public record RecentSessionsResponse(
    List<RecentSessionItem> items,
    int count,
    int limit,
    String lastUpdated) {}
