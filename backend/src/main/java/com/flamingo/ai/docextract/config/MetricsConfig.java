package com.flamingo.ai.docextract.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring for extraction timers and fusion/unit counters. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on the extraction entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> extractionCommonTags(
      @Value("${spring.application.name:docextract}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
