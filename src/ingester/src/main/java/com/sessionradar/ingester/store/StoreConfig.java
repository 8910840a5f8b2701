package com.sessionradar.ingester.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionradar.ingester.config.IngesterProperties;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Wires the ephemeral document backend selected by {@code ingester.store.backend}. */
@Configuration
public class StoreConfig {
  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  public DocumentStore documentStore(
      IngesterProperties properties,
      ObjectMapper objectMapper,
      ObjectProvider<StringRedisTemplate> redisTemplate) {
    IngesterProperties.Store store = properties.store();
    String backend = store.backend() == null ? "file" : store.backend().trim().toLowerCase(Locale.ROOT);
    DocumentStore documentStore = switch (backend) {
      case "redis" -> new RedisDocumentStore(
          redisTemplate.getObject(), objectMapper, store.redisKeyPrefix());
      case "file" -> new FileDocumentStore(Path.of(store.directory()), objectMapper);
      default -> throw new IllegalStateException(
          "ingester.store.backend must be file or redis, got: " + store.backend());
    };
    log.info("Ephemeral session documents stored in {}", documentStore.describe());
    return documentStore;
  }
}
