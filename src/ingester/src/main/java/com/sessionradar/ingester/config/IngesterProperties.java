package com.sessionradar.ingester.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(
    Mode mode,
    long refreshMs,
    Tracking tracking,
    Feed feed,
    Classifier classifier,
    Store store,
    Durable durable,
    Backfill backfill) {

  public enum Mode {
    LIVE,
    SYNC,
    BACKFILL
  }

  /**
   * Session lifecycle settings.
   *
   * @param staleThresholdMs how long an open session may be absent from snapshots before it is closed
   * @param historyLimit max number of closed sessions kept in the history document
   * @param pseudoSuffixes controller callsign suffixes excluded from durations and counts
   */
  public record Tracking(long staleThresholdMs, int historyLimit, List<String> pseudoSuffixes) {}

  public record Feed(String url, long timeoutMs) {}

  public record Classifier(
      String controllerPattern,
      List<String> facilityNames,
      List<String> regionIds,
      List<String> routePrefixes,
      String geofencePath) {}

  public record Store(String backend, String directory, String redisKeyPrefix) {}

  public record Durable(boolean enabled, String path, int queueCapacity) {}

  public record Backfill(String baseUrl, String apiKey, String since, int pageSize, long timeoutMs) {}
}
