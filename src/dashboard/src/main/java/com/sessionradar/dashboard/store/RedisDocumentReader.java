package com.sessionradar.dashboard.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Reads the JSON string stored under {@code <keyPrefix><name>}. */
public class RedisDocumentReader implements DocumentReader {
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisDocumentReader(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public <T> Optional<T> read(String name, Class<T> type) {
    String payload = redisTemplate.opsForValue().get(keyPrefix + name);
    if (payload == null || payload.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(payload, type));
    } catch (JsonProcessingException ex) {
      throw new StoreReadException("Unable to parse document " + keyPrefix + name, ex);
    }
  }

  @Override
  public String describe() {
    return "redis:" + keyPrefix;
  }
}
