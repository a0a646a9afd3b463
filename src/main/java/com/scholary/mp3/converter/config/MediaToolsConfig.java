package com.scholary.mp3.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mp3.converter.source.MediaSource;
import com.scholary.mp3.converter.source.YtDlpMediaSource;
import com.scholary.mp3.converter.source.YtDlpProperties;
import com.scholary.mp3.converter.transcode.FfmpegProperties;
import com.scholary.mp3.converter.transcode.FfmpegTranscoder;
import com.scholary.mp3.converter.transcode.Transcoder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the external media tools: yt-dlp for fetching and ffmpeg for transcoding.
 */
@Configuration
@EnableConfigurationProperties({
  FfmpegProperties.class,
  YtDlpProperties.class,
  ConversionProperties.class
})
public class MediaToolsConfig {

  @Bean
  public MediaSource mediaSource(YtDlpProperties properties, ObjectMapper objectMapper) {
    return new YtDlpMediaSource(properties, objectMapper);
  }

  @Bean
  public Transcoder transcoder(FfmpegProperties properties) {
    return new FfmpegTranscoder(properties);
  }
}
