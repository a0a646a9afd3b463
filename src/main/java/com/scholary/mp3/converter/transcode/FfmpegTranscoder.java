package com.scholary.mp3.converter.transcode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcodes audio by piping it through ffmpeg.
 *
 * <p>Input is fed to ffmpeg's stdin and the encoded result is copied from its stdout, each on its
 * own thread. The calling thread reads stderr, where ffmpeg reports the input duration once and
 * then a running {@code time=} position; the ratio of the two is the progress fraction.
 */
public class FfmpegTranscoder implements Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  // Example:   Duration: 00:03:33.02, start: 0.000000, bitrate: 128 kb/s
  static final Pattern DURATION_PATTERN =
      Pattern.compile("Duration:\\s*(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
  // Example: size=    1024kB time=00:01:05.30 bitrate= 128.0kbits/s speed=12.1x
  static final Pattern TIME_PATTERN =
      Pattern.compile("time=\\s*(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

  private static final int STDERR_TAIL_LINES = 15;
  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  private final FfmpegProperties properties;

  public FfmpegTranscoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void transcode(
      InputStream input, OutputStream output, TranscodeOptions options, ProgressListener listener) {
    List<String> command = buildCommand(options);
    LOGGER.debug("Executing: {}", command);

    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new TranscodeException("Failed to start ffmpeg: " + e.getMessage(), e);
    }

    int n = THREAD_COUNTER.incrementAndGet();
    AtomicReference<Exception> feedError = new AtomicReference<>();
    AtomicReference<Exception> drainError = new AtomicReference<>();
    Thread feeder =
        start(
            "ffmpeg-feed-" + n,
            () -> {
              try (OutputStream stdin = process.getOutputStream()) {
                input.transferTo(stdin);
              } catch (IOException | RuntimeException e) {
                feedError.set(e);
              }
            });
    Thread drainer =
        start(
            "ffmpeg-drain-" + n,
            () -> {
              try (InputStream stdout = process.getInputStream()) {
                stdout.transferTo(output);
              } catch (IOException | RuntimeException e) {
                drainError.set(e);
              }
            });

    Deque<String> stderrTail = new ArrayDeque<>();
    boolean finished = false;
    try {
      readProgress(process, options, listener, stderrTail);
      int exitCode = process.waitFor();
      feeder.join();
      drainer.join();
      finished = true;

      // A failing source explains a failing ffmpeg better than ffmpeg's own message
      if (feedError.get() instanceof RuntimeException) {
        throw (RuntimeException) feedError.get();
      }
      if (exitCode != 0) {
        throw new TranscodeException(
            "ffmpeg exited with code " + exitCode + ": " + String.join("\n", stderrTail).trim());
      }
      if (drainError.get() != null) {
        throw new TranscodeException(
            "Failed to write transcoded output: " + drainError.get().getMessage(),
            drainError.get());
      }
      if (feedError.get() != null) {
        LOGGER.debug("Input pipe closed early: {}", feedError.get().getMessage());
      }
      LOGGER.debug("ffmpeg finished successfully");

    } catch (IOException e) {
      throw new TranscodeException("Failed to read ffmpeg output: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscodeException("Transcoding interrupted", e);
    } finally {
      if (!finished) {
        process.destroyForcibly();
        feeder.interrupt();
      }
    }
  }

  List<String> buildCommand(TranscodeOptions options) {
    return List.of(
        properties.binary(),
        "-hide_banner",
        "-y",
        "-i",
        "pipe:0",
        "-vn",
        "-codec:a",
        properties.audioCodec(),
        "-b:a",
        options.bitrateKbps() + "k",
        "-f",
        options.format(),
        "pipe:1");
  }

  private void readProgress(
      Process process, TranscodeOptions options, ProgressListener listener, Deque<String> tail)
      throws IOException {
    Double totalSeconds = options.expectedDurationSeconds();

    // ffmpeg ends its status lines with '\r', which readLine also treats as a terminator
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8), 8192)) {
      String line;
      while ((line = reader.readLine()) != null) {
        remember(tail, line);

        Matcher durationMatcher = DURATION_PATTERN.matcher(line);
        if (durationMatcher.find()) {
          double probed = toSeconds(durationMatcher);
          if (probed > 0) {
            totalSeconds = probed;
          }
          continue;
        }

        Matcher timeMatcher = TIME_PATTERN.matcher(line);
        if (timeMatcher.find() && totalSeconds != null && totalSeconds > 0) {
          double fraction = Math.min(1.0, Math.max(0.0, toSeconds(timeMatcher) / totalSeconds));
          listener.onProgress(fraction);
        }
      }
    }
  }

  static double toSeconds(Matcher matcher) {
    return Integer.parseInt(matcher.group(1)) * 3600.0
        + Integer.parseInt(matcher.group(2)) * 60.0
        + Double.parseDouble(matcher.group(3));
  }

  private static void remember(Deque<String> tail, String line) {
    if (line.isBlank()) {
      return;
    }
    if (tail.size() == STDERR_TAIL_LINES) {
      tail.removeFirst();
    }
    tail.addLast(line);
  }

  private static Thread start(String name, Runnable task) {
    Thread thread = new Thread(task, name);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }
}
