package com.sessionradar.dashboard.service;

import com.sessionradar.dashboard.model.PeriodStats;
import com.sessionradar.dashboard.model.SessionRecord;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Folds closed sessions into period buckets.
 *
 * <p>Pure function of its input: pseudo sessions and records without a usable date or type are
 * left out, and the result is sorted by period key ascending.
 */
@Component
public class SessionAggregator {
  private final PseudoSessionFilter pseudoFilter;

  public SessionAggregator(PseudoSessionFilter pseudoFilter) {
    this.pseudoFilter = pseudoFilter;
  }

  public List<PeriodStats> aggregate(List<SessionRecord> history, GroupBy groupBy) {
    Map<String, Bucket> buckets = new TreeMap<>();
    for (SessionRecord session : history) {
      LocalDate date = session.periodDate();
      if (date == null || !pseudoFilter.isCountable(session)) {
        continue;
      }
      if (SessionRecord.CONTROLLER.equals(session.type())) {
        buckets.computeIfAbsent(groupBy.periodKey(date), k -> new Bucket()).addController(session.minutes());
      } else if (SessionRecord.PILOT.equals(session.type())) {
        buckets.computeIfAbsent(groupBy.periodKey(date), k -> new Bucket()).addPilot(session.minutes());
      }
    }
    List<PeriodStats> result = new ArrayList<>(buckets.size());
    buckets.forEach((period, b) -> result.add(new PeriodStats(
        period, b.controllerMinutes, b.controllerSessions, b.pilotMinutes, b.pilotSessions)));
    return result;
  }

  /** Totals over the whole list, same exclusions as {@link #aggregate}. */
  public PeriodStats totals(List<SessionRecord> history) {
    Bucket total = new Bucket();
    for (SessionRecord session : history) {
      if (!pseudoFilter.isCountable(session)) {
        continue;
      }
      if (SessionRecord.CONTROLLER.equals(session.type())) {
        total.addController(session.minutes());
      } else if (SessionRecord.PILOT.equals(session.type())) {
        total.addPilot(session.minutes());
      }
    }
    return new PeriodStats(
        "total", total.controllerMinutes, total.controllerSessions, total.pilotMinutes, total.pilotSessions);
  }

  private static final class Bucket {
    private long controllerMinutes;
    private long controllerSessions;
    private long pilotMinutes;
    private long pilotSessions;

    void addController(int minutes) {
      controllerMinutes += minutes;
      controllerSessions++;
    }

    void addPilot(int minutes) {
      pilotMinutes += minutes;
      pilotSessions++;
    }
  }
}
