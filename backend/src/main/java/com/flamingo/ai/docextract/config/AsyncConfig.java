package com.flamingo.ai.docextract.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared, bounded worker pools for the extraction pipeline.
 *
 * <p>Units and recognition calls run on separate pools so a unit task blocked on its images can
 * never occupy the threads its own recognition tasks need.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "unitProcessingExecutor")
  public ThreadPoolTaskExecutor unitProcessingExecutor(ExtractionConfig extractionConfig) {
    return buildExecutor(extractionConfig.getExecutor().getUnits(), "unit-proc-");
  }

  @Bean(name = "recognitionExecutor")
  public ThreadPoolTaskExecutor recognitionExecutor(ExtractionConfig extractionConfig) {
    return buildExecutor(extractionConfig.getExecutor().getRecognition(), "recognition-");
  }

  private ThreadPoolTaskExecutor buildExecutor(ExtractionConfig.Executor.Pool pool, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.getCorePoolSize());
    executor.setMaxPoolSize(pool.getMaxPoolSize());
    executor.setQueueCapacity(pool.getQueueCapacity());
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
