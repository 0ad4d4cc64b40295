package com.flamingo.ai.docsearch.service.health;

import com.flamingo.ai.docsearch.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics: documents, chunks and cache sizes.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
