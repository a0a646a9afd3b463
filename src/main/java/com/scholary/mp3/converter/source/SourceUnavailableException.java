package com.scholary.mp3.converter.source;

/**
 * Exception thrown when media cannot be fetched from its source.
 *
 * <p>This could be an unavailable or private video, a network failure, or the extraction tool
 * failing. The pipeline records it as the job's failure reason.
 */
public class SourceUnavailableException extends RuntimeException {

  public SourceUnavailableException(String message) {
    super(message);
  }

  public SourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
