package com.flamingo.ai.docsearch.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics setup: {@code @Timed} support on services and an {@code application} tag on every meter
 * so search, embedding and ingestion metrics can be told apart from other services.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterFilter applicationTagFilter(
      @Value("${spring.application.name:docsearch}") String applicationName) {
    return MeterFilter.commonTags(Tags.of("application", applicationName));
  }
}
