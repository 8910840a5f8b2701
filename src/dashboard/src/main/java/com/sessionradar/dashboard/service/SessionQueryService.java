package com.sessionradar.dashboard.service;

import com.sessionradar.dashboard.config.DashboardProperties;
import com.sessionradar.dashboard.model.DataStatusResponse;
import com.sessionradar.dashboard.model.HistoryDocument;
import com.sessionradar.dashboard.model.OpenSessionsDocument;
import com.sessionradar.dashboard.model.OpenSessionsResponse;
import com.sessionradar.dashboard.model.PeriodStats;
import com.sessionradar.dashboard.model.PeriodStatsItem;
import com.sessionradar.dashboard.model.RecentSessionItem;
import com.sessionradar.dashboard.model.RecentSessionsResponse;
import com.sessionradar.dashboard.model.SessionRecord;
import com.sessionradar.dashboard.model.StatsResponse;
import com.sessionradar.dashboard.model.StatsTotals;
import com.sessionradar.dashboard.store.DocumentReader;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Query service behind the dashboard session endpoints.
 *
 * <p>Every call reads the current documents, so the response reflects the last cycle the ingester
 * persisted. Missing documents read as empty and are reported through the {@code stale} flag
 * instead of an error.
 */
@Service
public class SessionQueryService {
  private static final HistoryDocument EMPTY_HISTORY = new HistoryDocument(null, List.of());
  private static final OpenSessionsDocument EMPTY_OPEN = new OpenSessionsDocument(null, null);

  private final DocumentReader reader;
  private final SessionAggregator aggregator;
  private final PseudoSessionFilter pseudoFilter;
  private final DashboardProperties properties;
  private final Clock clock;
  private final Timer aggregateTimer;

  @Autowired
  public SessionQueryService(
      DocumentReader reader,
      SessionAggregator aggregator,
      PseudoSessionFilter pseudoFilter,
      DashboardProperties properties) {
    this(reader, aggregator, pseudoFilter, properties, Clock.systemUTC());
  }

  SessionQueryService(
      DocumentReader reader,
      SessionAggregator aggregator,
      PseudoSessionFilter pseudoFilter,
      DashboardProperties properties,
      Clock clock) {
    this.reader = reader;
    this.aggregator = aggregator;
    this.pseudoFilter = pseudoFilter;
    this.properties = properties;
    this.clock = clock;
    this.aggregateTimer = Timer.builder("dashboard.sessions.aggregate.duration")
        .description("Time spent aggregating closed sessions into period buckets")
        .register(Metrics.globalRegistry);
  }

  /**
   * Builds the period series for {@code GET /api/sessions/stats}.
   *
   * @param groupByRaw optional {@code day|week|month|year}
   * @return totals plus one entry per non-empty period, oldest first
   */
  public StatsResponse getAggregatedStats(String groupByRaw) {
    GroupBy groupBy = QueryParser.parseGroupBy(groupByRaw, properties.getApi().getDefaultGroupBy());
    HistoryDocument history = readHistory();
    List<SessionRecord> sessions = history.sessionsOrEmpty();

    List<PeriodStats> periods = aggregateTimer.record(() -> aggregator.aggregate(sessions, groupBy));
    PeriodStats totals = aggregator.totals(sessions);
    return new StatsResponse(
        groupBy.value(),
        iso(history.lastUpdated()),
        new StatsTotals(
            totals.controllerMinutes(),
            QueryParser.formatMinutes(totals.controllerMinutes()),
            totals.controllerSessions(),
            totals.pilotMinutes(),
            QueryParser.formatMinutes(totals.pilotMinutes()),
            totals.pilotSessions()),
        periods.stream().map(SessionQueryService::toItem).toList());
  }

  /** Open sessions, longest running first. */
  public OpenSessionsResponse getOpenSessions() {
    OpenSessionsDocument document = readOpen();
    List<SessionRecord> items = document.sessionsOrEmpty().values().stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(SessionRecord::startTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SessionRecord::callsign, Comparator.nullsLast(Comparator.naturalOrder())))
        .toList();
    return new OpenSessionsResponse(items, items.size(), iso(document.lastUpdated()), isStale(document.lastUpdated()));
  }

  /**
   * Most recently ended sessions, pseudo sessions included and flagged.
   *
   * @param limitRaw optional positive limit, capped by {@code dashboard.api.recent-max-limit}
   */
  public RecentSessionsResponse getRecentClosedSessions(String limitRaw) {
    int limit = QueryParser.parseLimit(
        limitRaw, properties.getApi().getRecentDefaultLimit(), properties.getApi().getRecentMaxLimit());
    HistoryDocument history = readHistory();
    List<RecentSessionItem> items = history.sessionsOrEmpty().stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(SessionRecord::endTime, Comparator.nullsLast(Comparator.reverseOrder())))
        .limit(limit)
        .map(s -> new RecentSessionItem(s, QueryParser.formatMinutes(s.minutes()), pseudoFilter.isCountable(s)))
        .toList();
    return new RecentSessionsResponse(items, items.size(), limit, iso(history.lastUpdated()));
  }

  /** Document sizes and freshness for {@code GET /api/status}. */
  public DataStatusResponse getDataStatus() {
    OpenSessionsDocument open = readOpen();
    HistoryDocument history = readHistory();
    PeriodStats totals = aggregator.totals(history.sessionsOrEmpty());
    return new DataStatusResponse(
        reader.describe(),
        open.sessionsOrEmpty().size(),
        history.sessionsOrEmpty().size(),
        totals.controllerSessions(),
        totals.pilotSessions(),
        iso(open.lastUpdated()),
        iso(history.lastUpdated()),
        isStale(open.lastUpdated()));
  }

  boolean isStale(Instant lastUpdated) {
    if (lastUpdated == null) {
      return true;
    }
    Duration staleAfter = properties.getApi().getStaleAfter();
    return staleAfter != null && Duration.between(lastUpdated, clock.instant()).compareTo(staleAfter) > 0;
  }

  private HistoryDocument readHistory() {
    return reader.read(DocumentReader.HISTORY, HistoryDocument.class).orElse(EMPTY_HISTORY);
  }

  private OpenSessionsDocument readOpen() {
    return reader.read(DocumentReader.SESSIONS, OpenSessionsDocument.class).orElse(EMPTY_OPEN);
  }

  private static PeriodStatsItem toItem(PeriodStats stats) {
    return new PeriodStatsItem(
        stats.period(),
        stats.controllerMinutes(),
        QueryParser.formatMinutes(stats.controllerMinutes()),
        stats.controllerSessions(),
        stats.pilotMinutes(),
        QueryParser.formatMinutes(stats.pilotMinutes()),
        stats.pilotSessions());
  }

  private static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
