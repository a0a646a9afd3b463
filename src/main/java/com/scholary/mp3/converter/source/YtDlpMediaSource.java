package com.scholary.mp3.converter.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Media source backed by the yt-dlp command line tool.
 *
 * <p>Metadata comes from {@code --dump-single-json}; audio is streamed from yt-dlp's stdout with
 * {@code -o -}. Only YouTube URLs are accepted.
 */
public class YtDlpMediaSource implements MediaSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpMediaSource.class);
  private static final int STDERR_TAIL_LINES = 20;

  private final YtDlpProperties properties;
  private final ObjectMapper objectMapper;

  public YtDlpMediaSource(YtDlpProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean supports(String url) {
    return YouTubeUrls.isValid(url);
  }

  @Override
  public MediaMetadata fetchMetadata(String url) {
    List<String> command =
        List.of(
            properties.binary(),
            "--dump-single-json",
            "--no-playlist",
            "--skip-download",
            "--no-warnings",
            url);
    LOGGER.debug("Executing: {}", command);

    Process process = start(command, url);
    StderrTail stderr = StderrTail.drain(process, "yt-dlp-info");
    CompletableFuture<byte[]> stdout = readFully(process.getInputStream(), "yt-dlp-info-out");
    int timeoutSeconds = properties.metadataTimeoutSeconds();
    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw timedOut(url, timeoutSeconds);
      }
      if (process.exitValue() != 0) {
        throw new SourceUnavailableException(
            "Failed to fetch video info: " + stderr.summary(process.exitValue()));
      }
      JsonNode info = objectMapper.readTree(stdout.get(timeoutSeconds, TimeUnit.SECONDS));
      if (info == null || !info.hasNonNull("title")) {
        throw new SourceUnavailableException("Failed to fetch video info: no title for " + url);
      }
      Double duration = info.hasNonNull("duration") ? info.get("duration").asDouble() : null;
      MediaMetadata metadata = new MediaMetadata(info.get("title").asText(), duration);
      LOGGER.info(
          "Fetched metadata: url={}, title={}, duration={}s", url, metadata.title(), duration);
      return metadata;

    } catch (TimeoutException e) {
      throw timedOut(url, timeoutSeconds);
    } catch (ExecutionException e) {
      throw new SourceUnavailableException("Failed to read video info for " + url, e.getCause());
    } catch (IOException e) {
      throw new SourceUnavailableException("Failed to read video info for " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceUnavailableException("Interrupted fetching video info for " + url, e);
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  @Override
  public InputStream openAudioStream(String url, AudioQuality quality) {
    List<String> command =
        List.of(
            properties.binary(),
            "-f",
            quality.formatSelector(),
            "--no-playlist",
            "--quiet",
            "--no-warnings",
            "-o",
            "-",
            url);
    LOGGER.debug("Executing: {}", command);

    Process process = start(command, url);
    StderrTail stderr = StderrTail.drain(process, "yt-dlp-stream");
    return new ProcessOutputStream(process, stderr, url);
  }

  private static SourceUnavailableException timedOut(String url, int timeoutSeconds) {
    return new SourceUnavailableException(
        "Timed out fetching video info for " + url + " after " + timeoutSeconds + "s");
  }

  /** Reads a process stream to the end on a daemon thread. */
  private static CompletableFuture<byte[]> readFully(InputStream in, String threadName) {
    CompletableFuture<byte[]> result = new CompletableFuture<>();
    Thread reader =
        new Thread(
            () -> {
              try (InputStream stream = in) {
                result.complete(stream.readAllBytes());
              } catch (IOException e) {
                result.completeExceptionally(e);
              }
            },
            threadName);
    reader.setDaemon(true);
    reader.start();
    return result;
  }

  private Process start(List<String> command, String url) {
    try {
      return new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new SourceUnavailableException(
          "Failed to start " + properties.binary() + " for " + url, e);
    }
  }

  /** Audio bytes from yt-dlp's stdout; a non-zero exit surfaces at end of stream. */
  private static final class ProcessOutputStream extends FilterInputStream {

    private final Process process;
    private final StderrTail stderr;
    private final String url;
    private boolean exitChecked;

    ProcessOutputStream(Process process, StderrTail stderr, String url) {
      super(process.getInputStream());
      this.process = process;
      this.stderr = stderr;
      this.url = url;
    }

    @Override
    public int read() throws IOException {
      int b = super.read();
      if (b < 0) {
        checkExit();
      }
      return b;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
      int n = super.read(buffer, offset, length);
      if (n < 0) {
        checkExit();
      }
      return n;
    }

    private void checkExit() throws IOException {
      if (exitChecked) {
        return;
      }
      exitChecked = true;
      try {
        int exitCode = process.waitFor();
        if (exitCode != 0) {
          throw new SourceUnavailableException(
              "Failed to download audio for " + url + ": " + stderr.summary(exitCode));
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted waiting for yt-dlp", e);
      }
    }

    @Override
    public void close() throws IOException {
      try {
        super.close();
      } finally {
        if (process.isAlive()) {
          process.destroyForcibly();
        }
      }
    }
  }

  /** Keeps the last lines of a process's stderr so failures can be reported. */
  static final class StderrTail {

    private final Deque<String> lines = new ArrayDeque<>();
    private Thread reader;

    static StderrTail drain(Process process, String threadName) {
      StderrTail tail = new StderrTail();
      Thread reader =
          new Thread(
              () -> {
                try (BufferedReader in =
                    new BufferedReader(
                        new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                  String line;
                  while ((line = in.readLine()) != null) {
                    tail.add(line);
                  }
                } catch (IOException e) {
                  LOGGER.debug("{} stderr closed: {}", threadName, e.getMessage());
                }
              },
              threadName);
      reader.setDaemon(true);
      reader.start();
      tail.reader = reader;
      return tail;
    }

    synchronized void add(String line) {
      if (lines.size() == STDERR_TAIL_LINES) {
        lines.removeFirst();
      }
      lines.addLast(line);
    }

    String summary(int exitCode) {
      try {
        reader.join(1000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      String text;
      synchronized (this) {
        text = String.join("\n", lines).trim();
      }
      return text.isEmpty() ? "yt-dlp exited with code " + exitCode : text;
    }
  }
}
