package com.scholary.mp3.converter.pipeline;

import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobPatch;
import com.scholary.mp3.converter.job.JobStore;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Starts conversion pipelines on the conversion worker pool.
 *
 * <p>Launching never waits for the pipeline. Anything escaping the pipeline's own error handling
 * is logged from the future's completion stage. If the pool refuses the task the job is failed
 * straight away so it does not sit in PENDING forever.
 */
@Component
public class ConversionDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionDispatcher.class);

  static final String QUEUE_FULL_MESSAGE = "Conversion queue is full, please resubmit later";

  private final ConversionPipeline pipeline;
  private final JobStore jobStore;
  private final Executor executor;

  public ConversionDispatcher(
      ConversionPipeline pipeline,
      JobStore jobStore,
      @Qualifier("conversionExecutor") Executor executor) {
    this.pipeline = pipeline;
    this.jobStore = jobStore;
    this.executor = executor;
  }

  /**
   * Schedule the pipeline for a job.
   *
   * @return a future completing when the pipeline has finished, failed or was rejected
   */
  public CompletableFuture<Void> launch(ConversionJob job) {
    long jobId = job.id();
    try {
      return CompletableFuture.runAsync(() -> pipeline.run(jobId), executor)
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  LOGGER.error("Pipeline for job {} terminated unexpectedly", jobId, error);
                }
              });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Conversion pool rejected job {}: {}", jobId, e.getMessage());
      try {
        jobStore.update(jobId, JobPatch.failed(QUEUE_FULL_MESSAGE));
      } catch (RuntimeException updateError) {
        LOGGER.error("Could not mark rejected job {} as failed", jobId, updateError);
      }
      return CompletableFuture.completedFuture(null);
    }
  }
}
