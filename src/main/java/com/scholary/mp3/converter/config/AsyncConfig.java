package com.scholary.mp3.converter.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for conversion pipelines.
 *
 * <p>Each running pipeline holds a yt-dlp and an ffmpeg process, so the pool is fixed at
 * {@code conversion.asyncExecutorThreads}. Jobs beyond the queue are rejected outright and the
 * dispatcher marks them failed. Shutdown does not wait for in-flight conversions.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "conversionExecutor")
  public Executor conversionExecutor(ConversionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setThreadNamePrefix("conversion-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
