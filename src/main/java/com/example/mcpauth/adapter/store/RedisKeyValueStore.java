package com.example.mcpauth.adapter.store;

import com.example.mcpauth.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store. TTL is delegated to Redis key expiry.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException e) {
      log.error("Redis GET failed for key prefix {}", keyPrefix(key), e);
      throw new StoreException("Store read failed", e);
    }
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
    } catch (DataAccessException e) {
      log.error("Redis SET failed for key prefix {}", keyPrefix(key), e);
      throw new StoreException("Store write failed", e);
    }
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    try {
      return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    } catch (DataAccessException e) {
      log.error("Redis SET NX failed for key prefix {}", keyPrefix(key), e);
      throw new StoreException("Store write failed", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      redisTemplate.delete(key);
    } catch (DataAccessException e) {
      log.error("Redis DEL failed for key prefix {}", keyPrefix(key), e);
      throw new StoreException("Store delete failed", e);
    }
  }

  private static String keyPrefix(String key) {
    int separator = key.indexOf(':');
    return separator < 0 ? key : key.substring(0, separator + 1);
  }
}
