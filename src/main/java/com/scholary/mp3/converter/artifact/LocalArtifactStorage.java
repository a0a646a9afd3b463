package com.scholary.mp3.converter.artifact;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores artifacts as plain files in a single directory.
 *
 * <p>Keys map directly to file names. Keys that would resolve outside the directory are rejected.
 */
public class LocalArtifactStorage implements ArtifactStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStorage.class);

  private final Path directory;

  public LocalArtifactStorage(Path directory) {
    this.directory = directory.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to create artifact directory: " + directory, e);
    }
    LOGGER.info("Local artifact storage at {}", this.directory);
  }

  @Override
  public OutputStream openWrite(String key) {
    Path path = resolve(key);
    try {
      return Files.newOutputStream(path);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to open artifact for writing: " + key, e);
    }
  }

  @Override
  public InputStream openRead(String key) {
    Path path = resolve(key);
    try {
      return Files.newInputStream(path);
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(key, e);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to open artifact: " + key, e);
    }
  }

  @Override
  public long size(String key) {
    Path path = resolve(key);
    try {
      return Files.size(path);
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(key, e);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to read artifact size: " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public boolean remove(String key) {
    try {
      boolean removed = Files.deleteIfExists(resolve(key));
      LOGGER.debug("Remove artifact: key={}, removed={}", key, removed);
      return removed;
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to remove artifact: " + key, e);
    }
  }

  public Path directory() {
    return directory;
  }

  private Path resolve(String key) {
    Path path = directory.resolve(key).normalize();
    if (!path.getParent().equals(directory)) {
      throw new ArtifactStorageException("Invalid artifact key: " + key);
    }
    return path;
  }
}
