package com.sessionradar.dashboard.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/** Period granularity for aggregated stats. Keys sort chronologically as plain strings. */
public enum GroupBy {
  DAY {
    @Override
    public String periodKey(LocalDate date) {
      return date.toString();
    }
  },
  /** Weeks start on Monday and are keyed by that Monday's date. */
  WEEK {
    @Override
    public String periodKey(LocalDate date) {
      return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toString();
    }
  },
  MONTH {
    @Override
    public String periodKey(LocalDate date) {
      return date.format(MONTH_KEY);
    }
  },
  YEAR {
    @Override
    public String periodKey(LocalDate date) {
      return String.format("%04d", date.getYear());
    }
  };

  private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

  public abstract String periodKey(LocalDate date);

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
