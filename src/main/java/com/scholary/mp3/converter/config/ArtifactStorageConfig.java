package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.artifact.LocalArtifactStorage;
import com.scholary.mp3.converter.artifact.ObjectStoreProperties;
import com.scholary.mp3.converter.artifact.S3ArtifactStorage;
import java.nio.file.Paths;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for artifact storage.
 *
 * <p>Picks the backend from {@code artifacts.backend}: the local filesystem by default, or
 * S3/MinIO using the "objectstore.*" properties.
 */
@Configuration
@EnableConfigurationProperties(ArtifactProperties.class)
public class ArtifactStorageConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "artifacts",
      name = "backend",
      havingValue = "local",
      matchIfMissing = true)
  public ArtifactStorage localArtifactStorage(ArtifactProperties properties) {
    return new LocalArtifactStorage(Paths.get(properties.localDirectory()));
  }

  @Configuration
  @ConditionalOnProperty(prefix = "artifacts", name = "backend", havingValue = "s3")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class S3StorageConfig {

    @Bean(destroyMethod = "close")
    public ArtifactStorage s3ArtifactStorage(
        ObjectStoreProperties objectStore, ArtifactProperties properties) {
      return new S3ArtifactStorage(objectStore, Paths.get(properties.spoolDirectory()));
    }
  }
}
