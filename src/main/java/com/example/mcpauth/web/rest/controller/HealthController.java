package com.example.mcpauth.web.rest.controller;

import com.example.mcpauth.adapter.store.StoreHealthProbe;
import com.example.mcpauth.adapter.store.StoreHealthProbe.StoreHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";

  private final StoreHealthProbe storeHealthProbe;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.millis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    StoreHealth storeHealth = storeHealthProbe.check();

    Map<String, Object> storeStatus = new HashMap<>();
    storeStatus.put("status", storeHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    storeStatus.put("responseTimeMs", storeHealth.responseTimeMs());
    if (storeHealth.error() != null) {
      storeStatus.put("error", storeHealth.error());
    }

    Map<String, Object> status = new HashMap<>();
    status.put("status", storeHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    status.put("store", storeStatus);
    status.put("timestamp", clock.millis());

    if (!storeHealth.healthy()) {
      log.warn("Readiness check failed: {}", storeHealth.error());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(status);
    }
    return ResponseEntity.ok(status);
  }
}
