package com.scholary.mp3.converter.transcode;

/**
 * Exception thrown when transcoding fails.
 *
 * <p>This could be a missing ffmpeg binary, unreadable input, or ffmpeg exiting with an error.
 */
public class TranscodeException extends RuntimeException {

  public TranscodeException(String message) {
    super(message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
