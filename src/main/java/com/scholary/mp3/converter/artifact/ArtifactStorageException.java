package com.scholary.mp3.converter.artifact;

/**
 * Exception thrown when artifact storage operations fail.
 *
 * <p>Runtime because storage faults are not something callers can fix locally; they propagate to
 * the operation that triggered them.
 */
public class ArtifactStorageException extends RuntimeException {

  public ArtifactStorageException(String message) {
    super(message);
  }

  public ArtifactStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
