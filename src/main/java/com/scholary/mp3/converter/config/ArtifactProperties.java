package com.scholary.mp3.converter.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where artifacts are kept ("artifacts.*").
 *
 * <p>{@code backend} is {@code local} (files under {@code localDirectory}) or {@code s3} (see
 * "objectstore.*"). The spool directory buffers uploads for the S3 backend.
 */
@ConfigurationProperties(prefix = "artifacts")
@Validated
public record ArtifactProperties(
    @NotBlank String backend, @NotBlank String localDirectory, @NotBlank String spoolDirectory) {}
