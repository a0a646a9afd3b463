package com.scholary.mp3.converter.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Drives the yt-dlp integration with small shell scripts standing in for the real binary. */
class YtDlpMediaSourceTest {

  private static final String URL = "https://youtu.be/dQw4w9WgXcQ";

  @TempDir Path tempDir;

  private YtDlpMediaSource sourceFor(String script) throws IOException {
    return sourceFor(script, 10);
  }

  private YtDlpMediaSource sourceFor(String script, int metadataTimeoutSeconds)
      throws IOException {
    Path binary = tempDir.resolve("yt-dlp");
    Files.writeString(binary, "#!/bin/sh\n" + script + "\n");
    Files.setPosixFilePermissions(binary, PosixFilePermissions.fromString("rwx------"));
    return new YtDlpMediaSource(
        new YtDlpProperties(binary.toString(), metadataTimeoutSeconds), new ObjectMapper());
  }

  @Test
  void supportsOnlyYouTubeUrls() {
    YtDlpMediaSource source =
        new YtDlpMediaSource(new YtDlpProperties("yt-dlp", 10), new ObjectMapper());

    assertThat(source.supports(URL)).isTrue();
    assertThat(source.supports("https://example.com/video.mp4")).isFalse();
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void parsesTitleAndDuration() throws IOException {
    YtDlpMediaSource source =
        sourceFor("echo '{\"id\":\"dQw4w9WgXcQ\",\"title\":\"Never Gonna\",\"duration\":213}'");

    MediaMetadata metadata = source.fetchMetadata(URL);

    assertThat(metadata.title()).isEqualTo("Never Gonna");
    assertThat(metadata.durationSeconds()).isEqualTo(213.0);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void failingMetadataFetchIsSourceUnavailable() throws IOException {
    YtDlpMediaSource source = sourceFor("echo 'ERROR: Video unavailable' >&2; exit 1");

    assertThatThrownBy(() -> source.fetchMetadata(URL))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("Video unavailable");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @Timeout(5)
  void hungMetadataFetchTimesOut() throws IOException {
    YtDlpMediaSource source = sourceFor("exec sleep 8", 1);

    assertThatThrownBy(() -> source.fetchMetadata(URL))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("Timed out fetching video info");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void metadataWithoutTitleIsSourceUnavailable() throws IOException {
    YtDlpMediaSource source = sourceFor("echo '{\"id\":\"dQw4w9WgXcQ\"}'");

    assertThatThrownBy(() -> source.fetchMetadata(URL))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("no title");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void streamsAudioFromStdout() throws IOException {
    YtDlpMediaSource source = sourceFor("printf 'audio-bytes'");

    try (InputStream in = source.openAudioStream(URL, AudioQuality.HIGHEST)) {
      assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("audio-bytes");
    }
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void failedDownloadSurfacesAtEndOfStream() throws IOException {
    YtDlpMediaSource source = sourceFor("printf 'partial'; echo 'ERROR: HTTP 403' >&2; exit 1");

    try (InputStream in = source.openAudioStream(URL, AudioQuality.HIGHEST)) {
      assertThatThrownBy(in::readAllBytes)
          .isInstanceOf(SourceUnavailableException.class)
          .hasMessageContaining("403");
    }
  }

  @Test
  void missingBinaryIsSourceUnavailable() {
    YtDlpMediaSource source =
        new YtDlpMediaSource(
            new YtDlpProperties(tempDir.resolve("does-not-exist").toString(), 10),
            new ObjectMapper());

    assertThatThrownBy(() -> source.fetchMetadata(URL))
        .isInstanceOf(SourceUnavailableException.class);
  }
}
