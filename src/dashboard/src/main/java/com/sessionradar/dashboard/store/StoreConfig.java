package com.sessionradar.dashboard.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionradar.dashboard.config.DashboardProperties;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Selects the document backend with {@code dashboard.store.backend} ({@code file|redis}). */
@Configuration
public class StoreConfig {
  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  public DocumentReader documentReader(
      DashboardProperties properties,
      ObjectMapper objectMapper,
      ObjectProvider<StringRedisTemplate> redisTemplate) {
    DashboardProperties.Store store = properties.getStore();
    String backend = store.getBackend() == null ? "file" : store.getBackend().trim().toLowerCase(Locale.ROOT);
    DocumentReader reader = switch (backend) {
      case "redis" -> new RedisDocumentReader(
          redisTemplate.getObject(), objectMapper, store.getRedisKeyPrefix());
      case "file" -> new FileDocumentReader(Path.of(store.getDirectory()), objectMapper);
      default -> throw new IllegalStateException(
          "dashboard.store.backend must be file or redis, got: " + store.getBackend());
    };
    log.info("Reading session documents from {}", reader.describe());
    return reader;
  }
}
