package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.response.SystemStats;
import com.flamingo.ai.docsearch.service.cache.CacheEvictionScheduler;
import com.flamingo.ai.docsearch.service.health.HealthService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks, statistics and cache maintenance. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;
  private final CacheEvictionScheduler cacheEvictionScheduler;

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "docsearch");
    return ResponseEntity.ok(health);
  }

  /** Returns document, chunk and cache statistics. */
  @GetMapping("/stats")
  public ResponseEntity<SystemStats> stats() {
    return ResponseEntity.ok(healthService.getSystemStats());
  }

  /** Evicts expired search cache entries immediately. */
  @PostMapping("/cache/evictions")
  public ResponseEntity<Map<String, Object>> evictExpiredCache() {
    Map<String, Object> result = new HashMap<>();
    result.put("evicted", cacheEvictionScheduler.evictExpired());
    result.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(result);
  }
}
