package com.scholary.mp3.converter.artifact;

/** Thrown when the bytes behind an artifact key are gone. */
public class ArtifactNotFoundException extends ArtifactStorageException {

  public ArtifactNotFoundException(String key) {
    super("Artifact not found: " + key);
  }

  public ArtifactNotFoundException(String key, Throwable cause) {
    super("Artifact not found: " + key, cause);
  }
}
