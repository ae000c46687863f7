package com.scholary.cog.converter.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up a bounded thread pool for async batches. Each batch runs its jobs sequentially on one
 * thread; the pool size bounds how many batches convert at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(CogProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("cog-batch-");
    executor.initialize();
    return executor;
  }
}
