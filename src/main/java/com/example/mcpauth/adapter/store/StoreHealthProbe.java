package com.example.mcpauth.adapter.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Store health check: a write, read and delete round-trip on a throwaway key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreHealthProbe {

  private static final String PROBE_KEY_PREFIX = "health:probe:";
  private static final Duration PROBE_TTL = Duration.ofSeconds(30);

  private final KeyValueStore store;

  public StoreHealth check() {
    long startTime = System.currentTimeMillis();
    String key = PROBE_KEY_PREFIX + UUID.randomUUID();
    String value = String.valueOf(startTime);

    try {
      store.put(key, value, PROBE_TTL);
      boolean readBack = store.get(key).map(value::equals).orElse(false);
      store.delete(key);
      long responseTime = System.currentTimeMillis() - startTime;
      return readBack
          ? StoreHealth.healthy(responseTime)
          : StoreHealth.unhealthy("Probe value not readable after write");
    } catch (RuntimeException e) {
      log.error("Store health check failed", e);
      return StoreHealth.unhealthy(e.getMessage());
    }
  }

  /**
   * Store Health Check Response
   */
  public record StoreHealth(boolean healthy, long responseTimeMs, String error) {

    public static StoreHealth healthy(long responseTimeMs) {
      return new StoreHealth(true, responseTimeMs, null);
    }

    public static StoreHealth unhealthy(String error) {
      return new StoreHealth(false, 0, error);
    }
  }
}
