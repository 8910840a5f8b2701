package com.sessionradar.ingester.backfill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.feed.FeedUnavailableException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Client for the paged controller history endpoint ({@code /v2/atc/history}). */
@Component
public class AtcHistoryClient {
  private final IngesterProperties.Backfill settings;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public AtcHistoryClient(IngesterProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
    this.settings = properties.backfill();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  public AtcHistoryPage fetchPage(int limit, int offset) {
    String apiKey = settings.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException("ingester.backfill.api-key is not configured");
    }
    URI uri = URI.create(String.format(
        "%s/v2/atc/history?limit=%d&offset=%d", trimSlash(settings.baseUrl()), limit, offset));
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(Duration.ofMillis(settings.timeoutMs()))
        .header("X-API-Key", apiKey)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new FeedUnavailableException("History request interrupted", ex);
    } catch (IOException ex) {
      throw new FeedUnavailableException("History request failed: " + ex.getMessage(), ex);
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new FeedUnavailableException("History endpoint returned status " + response.statusCode());
    }
    return parse(response.body());
  }

  AtcHistoryPage parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException ex) {
      throw new FeedUnavailableException("History body is not valid JSON", ex);
    }
    if (root == null || root.isMissingNode()) {
      throw new FeedUnavailableException("History body is empty");
    }
    List<AtcHistoryItem> items = new ArrayList<>();
    for (JsonNode item : root.path("items")) {
      JsonNode connection = item.path("connection_id");
      items.add(new AtcHistoryItem(
          text(connection, "callsign"),
          cid(connection.path("vatsim_id")),
          text(connection, "start"),
          text(connection, "end")));
    }
    JsonNode count = root.path("count");
    return new AtcHistoryPage(items, count.canConvertToLong() ? count.asLong() : null);
  }

  private static Long cid(JsonNode node) {
    if (node.isIntegralNumber()) {
      return node.asLong();
    }
    if (node.isTextual() && node.asText().trim().matches("\\d+")) {
      return Long.parseLong(node.asText().trim());
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText().trim();
  }

  private static String trimSlash(String baseUrl) {
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }
}
