package com.sessionradar.dashboard.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the dashboard API service.
 *
 * <p>Values are bound from {@code dashboard.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {
  private final Store store = new Store();
  private final Api api = new Api();
  private final Tracking tracking = new Tracking();

  public Store getStore() {
    return store;
  }

  public Api getApi() {
    return api;
  }

  public Tracking getTracking() {
    return tracking;
  }

  /** Where the ingester documents are read from; mirrors {@code ingester.store.*}. */
  public static class Store {
    private String backend = "file";
    private String directory = "data";
    private String redisKeyPrefix = "sessionradar:";

    public String getBackend() {
      return backend;
    }

    public void setBackend(String backend) {
      this.backend = backend;
    }

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }

    public String getRedisKeyPrefix() {
      return redisKeyPrefix;
    }

    public void setRedisKeyPrefix(String redisKeyPrefix) {
      this.redisKeyPrefix = redisKeyPrefix;
    }
  }

  /** API-level behavior configuration (limits, staleness, CORS). */
  public static class Api {
    private int recentDefaultLimit = 50;
    private int recentMaxLimit = 1000;
    private String defaultGroupBy = "day";
    private Duration staleAfter = Duration.ofMinutes(5);
    private final Cors cors = new Cors();

    public int getRecentDefaultLimit() {
      return recentDefaultLimit;
    }

    public void setRecentDefaultLimit(int recentDefaultLimit) {
      this.recentDefaultLimit = recentDefaultLimit;
    }

    public int getRecentMaxLimit() {
      return recentMaxLimit;
    }

    public void setRecentMaxLimit(int recentMaxLimit) {
      this.recentMaxLimit = recentMaxLimit;
    }

    public String getDefaultGroupBy() {
      return defaultGroupBy;
    }

    public void setDefaultGroupBy(String defaultGroupBy) {
      this.defaultGroupBy = defaultGroupBy;
    }

    public Duration getStaleAfter() {
      return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
    }

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Rules shared with the ingester; must match {@code ingester.tracking.pseudo-suffixes}. */
  public static class Tracking {
    private List<String> pseudoSuffixes = new ArrayList<>(List.of("_ATIS"));

    public List<String> getPseudoSuffixes() {
      return pseudoSuffixes;
    }

    public void setPseudoSuffixes(List<String> pseudoSuffixes) {
      this.pseudoSuffixes = pseudoSuffixes;
    }
  }
}
