package com.sessionradar.ingester.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Stores each document as one JSON string value under {@code <keyPrefix><name>}.
 *
 * <p>A single {@code SET} replaces the document, which keeps the full-rewrite semantics of the
 * file backend while letting the dashboard read the same keys.
 */
public class RedisDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(RedisDocumentStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisDocumentStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public <T> Optional<T> read(String name, Class<T> type) {
    try {
      String payload = redisTemplate.opsForValue().get(keyFor(name));
      if (payload == null || payload.isBlank()) {
        return Optional.empty();
      }
      return Optional.ofNullable(objectMapper.readValue(payload, type));
    } catch (JsonProcessingException ex) {
      log.error("Unable to parse document {} from Redis", name, ex);
      return Optional.empty();
    } catch (DataAccessException ex) {
      log.error("Unable to read document {} from Redis", name, ex);
      return Optional.empty();
    }
  }

  @Override
  public void write(String name, Object document) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(document);
    } catch (JsonProcessingException ex) {
      throw new StoreIoException("Failed to serialize document " + name, ex);
    }
    try {
      redisTemplate.opsForValue().set(keyFor(name), payload);
    } catch (DataAccessException ex) {
      throw new StoreIoException("Failed to write document " + name + " to Redis", ex);
    }
  }

  @Override
  public String describe() {
    return "redis:" + keyPrefix;
  }

  String keyFor(String name) {
    return keyPrefix + name;
  }
}
