package com.scholary.mp3.converter.api;

import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobStatus;
import java.time.Instant;

/**
 * Job state as shown to polling clients.
 *
 * <p>The storage key of the artifact is internal and not exposed; clients download through
 * {@code /api/download/{id}}.
 */
public record ConversionResponse(
    long id,
    String url,
    String title,
    JobStatus status,
    int progress,
    String fileName,
    Long fileSize,
    String errorMessage,
    Instant createdAt,
    Instant completedAt) {

  public static ConversionResponse from(ConversionJob job) {
    return new ConversionResponse(
        job.id(),
        job.sourceUrl(),
        job.title(),
        job.status(),
        job.progress(),
        job.fileName(),
        job.fileSize(),
        job.errorMessage(),
        job.createdAt(),
        job.completedAt());
  }
}
