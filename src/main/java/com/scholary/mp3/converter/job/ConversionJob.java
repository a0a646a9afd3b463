package com.scholary.mp3.converter.job;

import java.time.Instant;

/**
 * Immutable snapshot of a conversion job.
 *
 * <p>The store replaces the whole snapshot on every update, so readers never observe a partially
 * applied change.
 *
 * @param id unique, monotonically assigned identifier
 * @param sourceUrl the submitted media reference
 * @param title sanitized media title, null until the metadata fetch succeeds
 * @param status current lifecycle state
 * @param progress percentage 0-100
 * @param artifactKey storage key of the produced MP3, set on completion
 * @param fileName display file name offered to clients, set on completion
 * @param fileSize artifact size in bytes, set on completion
 * @param errorMessage failure detail, set when the job fails
 * @param createdAt creation time
 * @param completedAt completion time, set when the job completes
 */
public record ConversionJob(
    long id,
    String sourceUrl,
    String title,
    JobStatus status,
    int progress,
    String artifactKey,
    String fileName,
    Long fileSize,
    String errorMessage,
    Instant createdAt,
    Instant completedAt) {

  /** A freshly submitted job: pending, zero progress, nothing discovered yet. */
  public static ConversionJob pending(long id, String sourceUrl, Instant createdAt) {
    return new ConversionJob(
        id, sourceUrl, null, JobStatus.PENDING, 0, null, null, null, null, createdAt, null);
  }

  public boolean hasArtifact() {
    return artifactKey != null;
  }
}
