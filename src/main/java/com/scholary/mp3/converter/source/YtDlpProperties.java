package com.scholary.mp3.converter.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the yt-dlp media source ("ytdlp.*"). */
@ConfigurationProperties(prefix = "ytdlp")
@Validated
public record YtDlpProperties(@NotBlank String binary, @Positive int metadataTimeoutSeconds) {}
