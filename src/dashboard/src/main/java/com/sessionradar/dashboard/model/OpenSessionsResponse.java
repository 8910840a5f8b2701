package com.sessionradar.dashboard.model;

import java.util.List;

/**
 * Response payload for {@code GET /api/sessions/open}.
 *
 * @param stale {@code true} when the ingester has not written the document recently
 */
public record OpenSessionsResponse(
    List<SessionRecord> items,
    int count,
    String lastUpdated,
    boolean stale) {}
