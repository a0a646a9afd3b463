package com.scholary.mp3.converter.artifact;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Abstraction for where converted MP3 files live.
 *
 * <p>Keys are opaque and unique per job, so implementations need no locking beyond what the
 * underlying substrate provides. Backends: local filesystem (default) and S3/MinIO.
 */
public interface ArtifactStorage {

  /**
   * Open a sink for a new artifact. The artifact becomes visible once the stream is closed.
   *
   * @param key the storage key
   * @return a stream the caller must close
   * @throws ArtifactStorageException if the sink cannot be opened
   */
  OutputStream openWrite(String key);

  /**
   * Open an existing artifact for reading. The caller is responsible for closing the stream.
   *
   * @throws ArtifactNotFoundException if no artifact exists under the key
   * @throws ArtifactStorageException if retrieval fails
   */
  InputStream openRead(String key);

  /**
   * Size of a stored artifact in bytes.
   *
   * @throws ArtifactNotFoundException if no artifact exists under the key
   */
  long size(String key);

  boolean exists(String key);

  /**
   * Remove an artifact. Best effort.
   *
   * @return true if something was removed
   */
  boolean remove(String key);
}
