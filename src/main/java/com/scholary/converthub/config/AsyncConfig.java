package com.scholary.converthub.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two pools:
 *
 * <ul>
 *   <li>{@code taskExecutor}: runs whole jobs in the background (async batch submissions and
 *       tracked single-file conversions). Bounded queue, so overload is rejected early.
 *   <li>{@code conversionExecutor}: runs individual file conversions for batches. Its size is the
 *       global cap on simultaneous conversions; per-batch semaphores gate what gets submitted.
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public ThreadPoolTaskExecutor taskExecutor(ConversionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("conversion-job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "conversionExecutor", destroyMethod = "shutdownNow")
  public ExecutorService conversionExecutor(BatchProperties properties) {
    int threads = properties.globalConcurrency();
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        new CustomizableThreadFactory("batch-unit-"));
  }
}
