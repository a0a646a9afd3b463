package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.job.InMemoryJobStore;
import com.scholary.mp3.converter.job.JobStore;
import com.scholary.mp3.converter.user.InMemoryUserStore;
import com.scholary.mp3.converter.user.UserStore;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the job and user stores.
 *
 * <p>Both live for the lifetime of the application context. Jobs evicted by the retention
 * settings take their artifacts with them.
 */
@Configuration
@EnableConfigurationProperties(JobStoreProperties.class)
public class JobStoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStoreConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public JobStore jobStore(
      JobStoreProperties properties, ArtifactStorage artifactStorage, Clock clock) {
    return new InMemoryJobStore(
        properties.maxSize(),
        Duration.ofMinutes(properties.expireAfterMinutes()),
        clock,
        job -> {
          if (job.artifactKey() != null) {
            boolean removed = artifactStorage.remove(job.artifactKey());
            LOGGER.debug("Removed artifact of evicted job {}: {}", job.id(), removed);
          }
        });
  }

  @Bean
  public UserStore userStore() {
    return new InMemoryUserStore();
  }
}
