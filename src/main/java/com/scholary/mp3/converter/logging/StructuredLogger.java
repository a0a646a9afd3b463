package com.scholary.mp3.converter.logging;

import com.scholary.mp3.converter.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job lifecycle events carry an {@code event_type} field plus the job context, so they can be
 * filtered per job in the log pipeline.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job status change. */
  public void logJobTransition(long jobId, JobStatus status, int progress) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("status", status.wireName());
      MDC.put("progress", String.valueOf(progress));

      logger.info("Job transition: jobId={}, status={}, progress={}%", jobId, status, progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcoding progress. */
  public void logJobProgress(long jobId, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("progress", String.valueOf(percentComplete));

      logger.debug("Job progress: jobId={}, progress={}%", jobId, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failure. */
  public void logJobFailed(long jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      logger.error("Job failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a pipeline that stopped because its job record disappeared. */
  public void logJobVanished(long jobId, String phase) {
    try {
      MDC.put("event_type", "job_vanished");
      MDC.put("phase", phase);

      logger.info("Job vanished, stopping: jobId={}, phase={}", jobId, phase);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(long jobId, String sourceUrl) {
    MDC.put("jobId", String.valueOf(jobId));
    MDC.put("sourceUrl", sourceUrl);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceUrl");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("status");
    MDC.remove("progress");
    MDC.remove("errorType");
    MDC.remove("phase");
  }
}
