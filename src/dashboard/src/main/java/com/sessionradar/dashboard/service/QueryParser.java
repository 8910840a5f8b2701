package com.sessionradar.dashboard.service;

import com.sessionradar.dashboard.api.BadRequestException;
import java.util.Locale;

/** Parsing and validation of dashboard query parameters. */
public final class QueryParser {

  private QueryParser() {}

  /**
   * Parses a positive limit, capped at {@code maxLimit}.
   *
   * @param raw raw limit query value
   * @param defaultLimit value used when the parameter is absent
   * @param maxLimit upper bound applied to larger values
   * @return validated limit
   */
  public static int parseLimit(String raw, int defaultLimit, int maxLimit) {
    if (raw == null || raw.isBlank()) {
      return Math.min(defaultLimit, maxLimit);
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new BadRequestException("limit must be > 0");
      }
      return Math.min(parsed, maxLimit);
    } catch (NumberFormatException ex) {
      throw new BadRequestException("limit must be an integer");
    }
  }

  /**
   * Parses the period granularity.
   *
   * @param raw raw groupBy query value ({@code day|week|month|year}, case-insensitive)
   * @param defaultValue value used when the parameter is absent
   * @return parsed granularity
   */
  public static GroupBy parseGroupBy(String raw, String defaultValue) {
    String value = raw == null || raw.isBlank() ? defaultValue : raw;
    if (value == null || value.isBlank()) {
      return GroupBy.DAY;
    }
    try {
      return GroupBy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("groupBy must be one of: day,week,month,year");
    }
  }

  /** Formats whole minutes as {@code HHH:MM:SS}; hours are not capped at three digits. */
  public static String formatMinutes(long totalMinutes) {
    long totalSeconds = Math.max(0L, totalMinutes) * 60L;
    long hours = totalSeconds / 3600;
    long minutes = (totalSeconds % 3600) / 60;
    long seconds = totalSeconds % 60;
    return String.format("%03d:%02d:%02d", hours, minutes, seconds);
  }
}
