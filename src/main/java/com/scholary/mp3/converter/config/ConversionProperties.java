package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.source.AudioQuality;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for conversion processing ("conversion.*").
 *
 * <p>Controls output settings, batch limits, and the worker pool that runs pipelines.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public record ConversionProperties(
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Min(1) @Max(100) int maxBatchSize,
    @Positive int bitrateKbps,
    @NotBlank String format,
    @NotNull AudioQuality audioQuality) {}
