package com.sessionradar.dashboard.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sessionradar.dashboard.model.DataStatusResponse;
import com.sessionradar.dashboard.model.OpenSessionsResponse;
import com.sessionradar.dashboard.model.PeriodStatsItem;
import com.sessionradar.dashboard.model.RecentSessionItem;
import com.sessionradar.dashboard.model.RecentSessionsResponse;
import com.sessionradar.dashboard.model.SessionRecord;
import com.sessionradar.dashboard.model.StatsResponse;
import com.sessionradar.dashboard.model.StatsTotals;
import com.sessionradar.dashboard.service.SessionQueryService;
import com.sessionradar.dashboard.store.StoreReadException;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = SessionController.class)
class SessionControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private SessionQueryService sessionQueryService;

  @Test
  void stats_returns200() throws Exception {
    StatsResponse payload = new StatsResponse(
        "week",
        "2024-03-05T12:00:00Z",
        new StatsTotals(125, "002:05:00", 1, 30, "000:30:00", 1),
        List.of(new PeriodStatsItem("2024-02-26", 125, "002:05:00", 1, 30, "000:30:00", 1)));
    when(sessionQueryService.getAggregatedStats(eq("week"))).thenReturn(payload);

    mockMvc.perform(get("/api/sessions/stats").param("groupBy", "week"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.groupBy").value("week"))
        .andExpect(jsonPath("$.totals.controllerHours").value("002:05:00"))
        .andExpect(jsonPath("$.periods[0].period").value("2024-02-26"));
  }

  @Test
  void stats_invalidGroupByReturns400() throws Exception {
    when(sessionQueryService.getAggregatedStats(eq("decade")))
        .thenThrow(new BadRequestException("groupBy must be one of: day,week,month,year"));

    mockMvc.perform(get("/api/sessions/stats").param("groupBy", "decade"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"))
        .andExpect(jsonPath("$.message").value("groupBy must be one of: day,week,month,year"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  void recent_flattensSessionFields() throws Exception {
    SessionRecord session = new SessionRecord(
        "atc-OPKC_TWR-2024-03-01T10:00:00.000Z", "controller", 11L, "Jane", "OPKC_TWR",
        "118.300", "TWR", null, null, null, null,
        Instant.parse("2024-03-01T10:00:00Z"), null, Instant.parse("2024-03-01T11:00:00Z"),
        60, LocalDate.of(2024, 3, 1));
    when(sessionQueryService.getRecentClosedSessions(eq("1"))).thenReturn(new RecentSessionsResponse(
        List.of(new RecentSessionItem(session, "001:00:00", true)), 1, 1, "2024-03-01T11:00:15Z"));

    mockMvc.perform(get("/api/sessions/recent").param("limit", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.items[0].callsign").value("OPKC_TWR"))
        .andExpect(jsonPath("$.items[0].duration").value("001:00:00"))
        .andExpect(jsonPath("$.items[0].countable").value(true));
  }

  @Test
  void open_returns200() throws Exception {
    when(sessionQueryService.getOpenSessions())
        .thenReturn(new OpenSessionsResponse(List.of(), 0, null, true));

    mockMvc.perform(get("/api/sessions/open"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(0))
        .andExpect(jsonPath("$.stale").value(true));
  }

  @Test
  void status_storeUnavailableReturns502() throws Exception {
    when(sessionQueryService.getDataStatus())
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    mockMvc.perform(get("/api/status"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("backend_unavailable"));
  }

  @Test
  void status_unreadableDocumentReturns502() throws Exception {
    when(sessionQueryService.getDataStatus())
        .thenThrow(new StoreReadException("bad json", new IOException("truncated")));

    mockMvc.perform(get("/api/status"))
        .andExpect(status().isBadGateway());
  }

  @Test
  void status_returns200() throws Exception {
    when(sessionQueryService.getDataStatus()).thenReturn(new DataStatusResponse(
        "redis:sessionradar:", 2, 10, 4, 6, "2024-03-05T12:00:00Z", "2024-03-05T11:59:45Z", false));

    mockMvc.perform(get("/api/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.backend").value("redis:sessionradar:"))
        .andExpect(jsonPath("$.historySessions").value(10));
  }

  @Test
  void unexpectedErrorReturns500() throws Exception {
    when(sessionQueryService.getOpenSessions()).thenThrow(new IllegalStateException("bug"));

    mockMvc.perform(get("/api/sessions/open"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("internal_error"));
  }
}
