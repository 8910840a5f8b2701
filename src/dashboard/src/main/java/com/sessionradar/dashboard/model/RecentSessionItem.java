package com.sessionradar.dashboard.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * One closed session in the recent list.
 *
 * @param countable {@code false} for pseudo sessions, which never contribute to totals
 */
public record RecentSessionItem(@JsonUnwrapped SessionRecord session, String duration, boolean countable) {}
