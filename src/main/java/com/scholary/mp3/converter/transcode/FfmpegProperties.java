package com.scholary.mp3.converter.transcode;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg ("ffmpeg.*").
 *
 * <p>The binary defaults to {@code ffmpeg} on the PATH and can be pointed elsewhere with the
 * FFMPEG_PATH environment variable.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @NotBlank String audioCodec) {}
