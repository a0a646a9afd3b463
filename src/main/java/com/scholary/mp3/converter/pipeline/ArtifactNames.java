package com.scholary.mp3.converter.pipeline;

import java.time.Instant;

/**
 * Naming rules for produced artifacts.
 *
 * <p>The storage key combines the job id with a creation-time nonce and never depends on the
 * title. The display name is what clients see when downloading.
 */
public final class ArtifactNames {

  private static final String EXTENSION = ".mp3";

  private ArtifactNames() {}

  public static String storageKey(long jobId, Instant now) {
    return jobId + "_" + now.toEpochMilli() + EXTENSION;
  }

  public static String displayName(String sanitizedTitle, long jobId) {
    return sanitizedTitle + "_" + jobId + EXTENSION;
  }
}
