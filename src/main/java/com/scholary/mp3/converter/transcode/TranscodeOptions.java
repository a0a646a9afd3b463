package com.scholary.mp3.converter.transcode;

/**
 * Target settings for one transcode.
 *
 * @param bitrateKbps audio bitrate, e.g. 128
 * @param format container/codec name understood by the transcoder, e.g. "mp3"
 * @param expectedDurationSeconds input length when known up front; used for progress when the
 *     transcoder cannot probe a piped input. May be null.
 */
public record TranscodeOptions(int bitrateKbps, String format, Double expectedDurationSeconds) {

  public TranscodeOptions {
    if (bitrateKbps <= 0) {
      throw new IllegalArgumentException("Bitrate must be positive: " + bitrateKbps);
    }
    if (format == null || format.isBlank()) {
      throw new IllegalArgumentException("Format must not be blank");
    }
  }
}
