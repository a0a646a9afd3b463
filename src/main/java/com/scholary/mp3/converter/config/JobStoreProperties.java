package com.scholary.mp3.converter.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention settings for the in-memory job store ("jobstore.*"). Zero disables the bound.
 */
@ConfigurationProperties(prefix = "jobstore")
@Validated
public record JobStoreProperties(
    @PositiveOrZero long maxSize, @PositiveOrZero int expireAfterMinutes) {}
