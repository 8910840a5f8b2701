package com.sessionradar.ingester.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.sessionradar.ingester.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class VatsimFeedClientTest {
  private HttpClient httpClient;
  private SimpleMeterRegistry meterRegistry;
  private VatsimFeedClient client;

  @BeforeEach
  void setUp() {
    httpClient = mock(HttpClient.class);
    meterRegistry = new SimpleMeterRegistry();
    client = new VatsimFeedClient(
        TestFixtures.properties(), httpClient, TestFixtures.objectMapper(), meterRegistry);
  }

  @Test
  void fetchMapsControllersAndPilotsWithFlightPlan() throws Exception {
    stubResponse(200, """
        {
          "general": {"update_timestamp": "2024-03-01T10:00:00Z"},
          "controllers": [
            {"cid": 1234, "name": "Jane Doe", "callsign": "OPKC_TWR", "frequency": "118.300", "facility": 4},
            {"callsign": "OPLA_GND"}
          ],
          "pilots": [
            {"cid": 42, "name": "Ali", "callsign": "PIA301", "latitude": 24.9, "longitude": 67.1,
             "flight_plan": {"departure": "opkc", "arrival": "OPLA", "aircraft_short": "A320"}},
            {"cid": 43, "callsign": "UAE612", "latitude": 25.2, "longitude": 55.3, "flight_plan": null}
          ]
        }
        """);

    FeedSnapshot snapshot = client.fetch();

    assertThat(snapshot.controllers()).containsExactly(
        new FeedController("OPKC_TWR", 1234L, "Jane Doe", "118.300", 4),
        new FeedController("OPLA_GND", null, null, null, null));
    assertThat(snapshot.pilots()).containsExactly(
        new FeedPilot("PIA301", 42L, "Ali", 24.9, 67.1, "opkc", "OPLA", "A320"),
        new FeedPilot("UAE612", 43L, null, 25.2, 55.3, null, null, null));
    assertThat(meterRegistry.get("ingester.feed.http.requests.total").tag("outcome", "success").counter().count())
        .isEqualTo(1.0);

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(request.getValue().uri()).hasToString("https://feed.example/v3/vatsim-data.json");
    assertThat(request.getValue().timeout()).contains(Duration.ofMillis(20_000));
  }

  @Test
  void nonSuccessStatusIsFeedUnavailable() throws Exception {
    stubResponse(503, "Service Unavailable");

    assertThatThrownBy(() -> client.fetch())
        .isInstanceOf(FeedUnavailableException.class)
        .hasMessageContaining("503");
  }

  @Test
  void bodyWithoutParticipantArraysIsFeedUnavailable() throws Exception {
    stubResponse(200, "{\"general\": {}}");

    assertThatThrownBy(() -> client.fetch()).isInstanceOf(FeedUnavailableException.class);
  }

  @Test
  void invalidJsonIsFeedUnavailable() throws Exception {
    stubResponse(200, "<html>maintenance</html>");

    assertThatThrownBy(() -> client.fetch()).isInstanceOf(FeedUnavailableException.class);
  }

  @Test
  void timeoutIsFeedUnavailable() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new HttpTimeoutException("request timed out"));

    assertThatThrownBy(() -> client.fetch())
        .isInstanceOf(FeedUnavailableException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(meterRegistry.get("ingester.feed.http.requests.total").tag("outcome", "exception").counter().count())
        .isEqualTo(1.0);
  }

  @SuppressWarnings("unchecked")
  private void stubResponse(int status, String body) throws Exception {
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
  }
}
