package com.scholary.mp3.converter.job;

import java.time.Instant;

/**
 * A partial update to a {@link ConversionJob}.
 *
 * <p>Only fields that were explicitly set are merged; everything else keeps its current value.
 * Write-once fields (title, artifact fields, error, completion time) are rejected if the job
 * already carries a value.
 *
 * <p>While the resulting status is PROCESSING, progress never goes backwards: the merged value is
 * the larger of the stored and supplied percentages. Transcoder progress callbacks are not
 * guaranteed to arrive in order.
 */
public final class JobPatch {

  private final JobStatus status;
  private final Integer progress;
  private final String title;
  private final String artifactKey;
  private final String fileName;
  private final Long fileSize;
  private final String errorMessage;
  private final Instant completedAt;

  private JobPatch(Builder builder) {
    this.status = builder.status;
    this.progress = builder.progress;
    this.title = builder.title;
    this.artifactKey = builder.artifactKey;
    this.fileName = builder.fileName;
    this.fileSize = builder.fileSize;
    this.errorMessage = builder.errorMessage;
    this.completedAt = builder.completedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Progress-only patch. */
  public static JobPatch progress(int progress) {
    return builder().progress(progress).build();
  }

  /** Marks the job as failed with the given detail. */
  public static JobPatch failed(String errorMessage) {
    return builder().status(JobStatus.FAILED).errorMessage(errorMessage).build();
  }

  /** Marks the job as completed, attaching the produced artifact. */
  public static JobPatch completed(
      String artifactKey, String fileName, long fileSize, Instant completedAt) {
    return builder()
        .status(JobStatus.COMPLETED)
        .progress(100)
        .artifactKey(artifactKey)
        .fileName(fileName)
        .fileSize(fileSize)
        .completedAt(completedAt)
        .build();
  }

  /**
   * Merge this patch into {@code current}, producing the next snapshot.
   *
   * @throws IllegalJobTransitionException if the patch would move the job backwards, out of a
   *     terminal state, or overwrite a write-once field
   */
  public ConversionJob applyTo(ConversionJob current) {
    JobStatus nextStatus = status != null ? status : current.status();
    if (!current.status().canTransitionTo(nextStatus)) {
      throw new IllegalJobTransitionException(current.id(), current.status(), nextStatus);
    }

    int nextProgress = current.progress();
    if (progress != null) {
      if (progress < 0 || progress > 100) {
        throw new IllegalArgumentException("Progress out of range: " + progress);
      }
      nextProgress =
          nextStatus == JobStatus.PROCESSING
              ? Math.max(current.progress(), progress)
              : progress;
    }

    return new ConversionJob(
        current.id(),
        current.sourceUrl(),
        writeOnce(current, "title", current.title(), title),
        nextStatus,
        nextProgress,
        writeOnce(current, "artifactKey", current.artifactKey(), artifactKey),
        writeOnce(current, "fileName", current.fileName(), fileName),
        writeOnce(current, "fileSize", current.fileSize(), fileSize),
        writeOnce(current, "errorMessage", current.errorMessage(), errorMessage),
        current.createdAt(),
        writeOnce(current, "completedAt", current.completedAt(), completedAt));
  }

  private static <T> T writeOnce(ConversionJob job, String field, T existing, T supplied) {
    if (supplied == null) {
      return existing;
    }
    if (existing != null) {
      throw new IllegalJobTransitionException(
          String.format("Job %d already has %s set", job.id(), field));
    }
    return supplied;
  }

  public JobStatus status() {
    return status;
  }

  public Integer progress() {
    return progress;
  }

  @Override
  public String toString() {
    return "JobPatch[status="
        + status
        + ", progress="
        + progress
        + ", title="
        + title
        + ", artifactKey="
        + artifactKey
        + ", errorMessage="
        + errorMessage
        + "]";
  }

  public static final class Builder {
    private JobStatus status;
    private Integer progress;
    private String title;
    private String artifactKey;
    private String fileName;
    private Long fileSize;
    private String errorMessage;
    private Instant completedAt;

    private Builder() {}

    public Builder status(JobStatus status) {
      this.status = status;
      return this;
    }

    public Builder progress(int progress) {
      this.progress = progress;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder artifactKey(String artifactKey) {
      this.artifactKey = artifactKey;
      return this;
    }

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    public Builder fileSize(long fileSize) {
      this.fileSize = fileSize;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public JobPatch build() {
      return new JobPatch(this);
    }
  }
}
