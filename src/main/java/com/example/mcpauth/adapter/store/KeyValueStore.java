package com.example.mcpauth.adapter.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value persistence with per-key time-to-live.
 * Offers no transactions and no cross-key atomicity; {@link #putIfAbsent} is the only
 * conditional primitive.
 */
public interface KeyValueStore {

  /**
   * Reads a live value. Expired keys are reported as absent.
   */
  Optional<String> get(String key);

  /**
   * Writes a value that expires after {@code ttl}.
   */
  void put(String key, String value, Duration ttl);

  /**
   * Writes a value only when the key is absent.
   *
   * @return {@code true} if this call created the key
   */
  boolean putIfAbsent(String key, String value, Duration ttl);

  void delete(String key);
}
