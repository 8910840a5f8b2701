package com.sessionradar.ingester.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionradar.ingester.config.IngesterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads the VATSIM v3 data feed ({@code controllers[]} and {@code pilots[]}). */
@Component
public class VatsimFeedClient implements SnapshotFetcher {
  private static final Logger log = LoggerFactory.getLogger(VatsimFeedClient.class);

  private final String url;
  private final Duration timeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter httpErrorCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public VatsimFeedClient(
      IngesterProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.url = properties.feed().url();
    this.timeout = Duration.ofMillis(properties.feed().timeoutMs());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.requestTimer = Timer.builder("ingester.feed.http.duration")
        .description("Feed snapshot HTTP request duration (seconds)")
        .register(meterRegistry);
    this.successCounter = Counter.builder("ingester.feed.http.requests.total")
        .description("Feed snapshot HTTP requests (by outcome)")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.httpErrorCounter = Counter.builder("ingester.feed.http.requests.total")
        .description("Feed snapshot HTTP requests (by outcome)")
        .tag("outcome", "http_error")
        .register(meterRegistry);
    this.exceptionCounter = Counter.builder("ingester.feed.http.requests.total")
        .description("Feed snapshot HTTP requests (by outcome)")
        .tag("outcome", "exception")
        .register(meterRegistry);

    meterRegistry.gauge("ingester.feed.http.last_status", lastStatusCode);
  }

  @Override
  public FeedSnapshot fetch() {
    if (url == null || url.isBlank()) {
      throw new FeedUnavailableException("Feed URL is not configured");
    }
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(timeout)
        .header("Accept", "application/json")
        .GET()
        .build();

    long startNs = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      lastStatusCode.set(0);
      exceptionCounter.increment();
      throw new FeedUnavailableException("Feed request interrupted", ex);
    } catch (IOException ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      throw new FeedUnavailableException("Feed request failed: " + ex.getMessage(), ex);
    } finally {
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }

    lastStatusCode.set(response.statusCode());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      httpErrorCounter.increment();
      throw new FeedUnavailableException("Feed returned status " + response.statusCode());
    }

    FeedSnapshot snapshot = parse(response.body());
    successCounter.increment();
    log.debug("Fetched feed snapshot: controllers={} pilots={}",
        snapshot.controllers().size(), snapshot.pilots().size());
    return snapshot;
  }

  FeedSnapshot parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException ex) {
      exceptionCounter.increment();
      throw new FeedUnavailableException("Feed body is not valid JSON", ex);
    }
    // A body without both arrays is unusable, not an empty network.
    if (root == null || !root.path("controllers").isArray() || !root.path("pilots").isArray()) {
      exceptionCounter.increment();
      throw new FeedUnavailableException("Feed body is missing the controllers or pilots array");
    }

    List<FeedController> controllers = new ArrayList<>();
    for (JsonNode row : root.path("controllers")) {
      if (row.isObject()) {
        controllers.add(new FeedController(
            text(row, "callsign"),
            longNumber(row, "cid"),
            text(row, "name"),
            text(row, "frequency"),
            intNumber(row, "facility")));
      }
    }

    List<FeedPilot> pilots = new ArrayList<>();
    for (JsonNode row : root.path("pilots")) {
      if (row.isObject()) {
        JsonNode plan = row.path("flight_plan");
        pilots.add(new FeedPilot(
            text(row, "callsign"),
            longNumber(row, "cid"),
            text(row, "name"),
            number(row, "latitude"),
            number(row, "longitude"),
            text(plan, "departure"),
            text(plan, "arrival"),
            text(plan, "aircraft_short")));
      }
    }
    return new FeedSnapshot(controllers, pilots);
  }

  private static String text(JsonNode row, String field) {
    JsonNode node = row.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private static Double number(JsonNode row, String field) {
    JsonNode node = row.get(field);
    return node == null || !node.isNumber() ? null : node.asDouble();
  }

  private static Long longNumber(JsonNode row, String field) {
    JsonNode node = row.get(field);
    return node == null || !node.canConvertToLong() ? null : node.asLong();
  }

  private static Integer intNumber(JsonNode row, String field) {
    JsonNode node = row.get(field);
    return node == null || !node.canConvertToInt() ? null : node.asInt();
  }
}
