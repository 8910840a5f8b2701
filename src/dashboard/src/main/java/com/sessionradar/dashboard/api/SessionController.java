package com.sessionradar.dashboard.api;

import com.sessionradar.dashboard.model.DataStatusResponse;
import com.sessionradar.dashboard.model.OpenSessionsResponse;
import com.sessionradar.dashboard.model.RecentSessionsResponse;
import com.sessionradar.dashboard.model.StatsResponse;
import com.sessionradar.dashboard.service.SessionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing read-only session endpoints.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/sessions/stats}: totals and per-period activity</li>
 *   <li>{@code GET /api/sessions/open}: sessions currently in progress</li>
 *   <li>{@code GET /api/sessions/recent}: most recently closed sessions</li>
 *   <li>{@code GET /api/status}: document freshness and sizes</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class SessionController {
  private final SessionQueryService sessionQueryService;

  public SessionController(SessionQueryService sessionQueryService) {
    this.sessionQueryService = sessionQueryService;
  }

  /**
   * Returns aggregated activity grouped by period.
   *
   * @param groupBy optional {@code day|week|month|year}
   * @return totals and ascending period series
   */
  @GetMapping("/sessions/stats")
  public StatsResponse stats(@RequestParam(value = "groupBy", required = false) String groupBy) {
    return sessionQueryService.getAggregatedStats(groupBy);
  }

  @GetMapping("/sessions/open")
  public OpenSessionsResponse open() {
    return sessionQueryService.getOpenSessions();
  }

  /**
   * Returns the latest closed sessions, newest first.
   *
   * @param limit optional max number of returned items
   * @return recent sessions with formatted durations
   */
  @GetMapping("/sessions/recent")
  public RecentSessionsResponse recent(@RequestParam(value = "limit", required = false) String limit) {
    return sessionQueryService.getRecentClosedSessions(limit);
  }

  @GetMapping("/status")
  public DataStatusResponse status() {
    return sessionQueryService.getDataStatus();
  }
}
