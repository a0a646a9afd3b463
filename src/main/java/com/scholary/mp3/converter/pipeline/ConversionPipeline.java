package com.scholary.mp3.converter.pipeline;

import com.scholary.mp3.converter.artifact.ArtifactLifecycle;
import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.artifact.ArtifactStorageException;
import com.scholary.mp3.converter.config.ConversionProperties;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobPatch;
import com.scholary.mp3.converter.job.JobStatus;
import com.scholary.mp3.converter.job.JobStore;
import com.scholary.mp3.converter.job.JobStoreException;
import com.scholary.mp3.converter.logging.StructuredLogger;
import com.scholary.mp3.converter.source.MediaMetadata;
import com.scholary.mp3.converter.source.MediaSource;
import com.scholary.mp3.converter.transcode.ProgressListener;
import com.scholary.mp3.converter.transcode.TranscodeOptions;
import com.scholary.mp3.converter.transcode.Transcoder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives one conversion job from PENDING to a terminal state.
 *
 * <p>Steps, each persisted before the next starts:
 *
 * <ol>
 *   <li>PROCESSING at {@value #ACCEPTED_PROGRESS}%
 *   <li>fetch metadata, store the sanitized title at {@value #METADATA_PROGRESS}%
 *   <li>stream the audio through the transcoder into artifact storage, mapping transcoder
 *       progress into [{@value #METADATA_PROGRESS}, {@value #MAX_TRANSCODE_PROGRESS}]
 *   <li>COMPLETED at 100% with the artifact attached
 * </ol>
 *
 * <p>Any failure along the way marks the job FAILED with the cause's message. If the job record
 * disappears (deleted by a client) the pipeline stops quietly: an update that finds no record is
 * the only cancellation signal. Job store faults are handled the same way.
 */
@Component
public class ConversionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionPipeline.class);

  static final int ACCEPTED_PROGRESS = 5;
  static final int METADATA_PROGRESS = 15;
  static final int MAX_TRANSCODE_PROGRESS = 95;
  static final String UNKNOWN_ERROR = "Unknown error occurred";

  private final JobStore jobStore;
  private final MediaSource mediaSource;
  private final Transcoder transcoder;
  private final ArtifactStorage artifactStorage;
  private final ArtifactLifecycle artifactLifecycle;
  private final ConversionProperties properties;
  private final Clock clock;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public ConversionPipeline(
      JobStore jobStore,
      MediaSource mediaSource,
      Transcoder transcoder,
      ArtifactStorage artifactStorage,
      ArtifactLifecycle artifactLifecycle,
      ConversionProperties properties,
      Clock clock) {
    this.jobStore = jobStore;
    this.mediaSource = mediaSource;
    this.transcoder = transcoder;
    this.artifactStorage = artifactStorage;
    this.artifactLifecycle = artifactLifecycle;
    this.properties = properties;
    this.clock = clock;
  }

  /** Run the pipeline for a job. Never throws for job-level failures. */
  public void run(long jobId) {
    Optional<ConversionJob> submitted = jobStore.get(jobId);
    if (submitted.isEmpty()) {
      structuredLogger.logJobVanished(jobId, "start");
      return;
    }
    String sourceUrl = submitted.get().sourceUrl();
    StructuredLogger.setJobContext(jobId, sourceUrl);

    String artifactKey = null;
    try {
      JobPatch accepted =
          JobPatch.builder().status(JobStatus.PROCESSING).progress(ACCEPTED_PROGRESS).build();
      if (!advance(jobId, "accept", accepted)) {
        return;
      }

      MediaMetadata metadata = mediaSource.fetchMetadata(sourceUrl);
      String title = TitleSanitizer.sanitize(metadata.title());
      JobPatch titled = JobPatch.builder().title(title).progress(METADATA_PROGRESS).build();
      if (!advance(jobId, "metadata", titled)) {
        return;
      }

      artifactKey = ArtifactNames.storageKey(jobId, clock.instant());
      String fileName = ArtifactNames.displayName(title, jobId);
      transcodeToArtifact(jobId, sourceUrl, metadata, artifactKey);

      long fileSize = artifactStorage.size(artifactKey);
      JobPatch completed = JobPatch.completed(artifactKey, fileName, fileSize, clock.instant());
      if (!advance(jobId, "complete", completed)) {
        artifactLifecycle.discard(artifactKey);
        return;
      }
      LOGGER.info(
          "Conversion completed: jobId={}, file={}, size={} bytes", jobId, fileName, fileSize);

    } catch (JobVanishedException e) {
      structuredLogger.logJobVanished(jobId, e.getMessage());
      discardPartial(artifactKey);
    } catch (JobStoreException e) {
      LOGGER.error("Job store failure, stopping pipeline: jobId={}", jobId, e);
      discardPartial(artifactKey);
    } catch (RuntimeException e) {
      fail(jobId, e);
      discardPartial(artifactKey);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void transcodeToArtifact(
      long jobId, String sourceUrl, MediaMetadata metadata, String artifactKey) {
    TranscodeOptions options =
        new TranscodeOptions(
            properties.bitrateKbps(), properties.format(), metadata.durationSeconds());
    ProgressRecorder recorder = new ProgressRecorder(jobId);

    try (InputStream audio = mediaSource.openAudioStream(sourceUrl, properties.audioQuality());
        OutputStream sink = artifactStorage.openWrite(artifactKey)) {
      transcoder.transcode(audio, sink, options, recorder);
    } catch (IOException e) {
      throw new ArtifactStorageException(
          "Failed to finalize artifact " + artifactKey + ": " + e.getMessage(), e);
    }
  }

  /**
   * Apply a patch to the job.
   *
   * @return false if the job no longer exists
   */
  private boolean advance(long jobId, String phase, JobPatch patch) {
    Optional<ConversionJob> updated = jobStore.update(jobId, patch);
    if (updated.isEmpty()) {
      structuredLogger.logJobVanished(jobId, phase);
      return false;
    }
    if (patch.status() != null) {
      structuredLogger.logJobTransition(jobId, updated.get().status(), updated.get().progress());
    }
    return true;
  }

  private void fail(long jobId, RuntimeException cause) {
    String message = errorMessage(cause);
    structuredLogger.logJobFailed(jobId, cause.getClass().getSimpleName(), message);
    LOGGER.debug("Failure cause for job {}", jobId, cause);
    try {
      if (jobStore.update(jobId, JobPatch.failed(message)).isEmpty()) {
        structuredLogger.logJobVanished(jobId, "fail");
      }
    } catch (RuntimeException e) {
      LOGGER.error("Could not record failure for job {}", jobId, e);
    }
  }

  private void discardPartial(String artifactKey) {
    if (artifactKey != null) {
      artifactLifecycle.discard(artifactKey);
    }
  }

  static String errorMessage(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? UNKNOWN_ERROR : message;
  }

  /** Maps transcoder fractions onto the job's progress band. */
  static int toPercent(double fraction) {
    int percent = (int) Math.round(fraction * 100);
    return Math.min(Math.max(percent, METADATA_PROGRESS), MAX_TRANSCODE_PROGRESS);
  }

  private final class ProgressRecorder implements ProgressListener {

    private final long jobId;
    private int lastWritten = METADATA_PROGRESS;

    ProgressRecorder(long jobId) {
      this.jobId = jobId;
    }

    @Override
    public void onProgress(double fraction) {
      int percent = toPercent(fraction);
      if (percent == lastWritten) {
        return;
      }
      if (jobStore.update(jobId, JobPatch.progress(percent)).isEmpty()) {
        throw new JobVanishedException("transcode");
      }
      lastWritten = percent;
      structuredLogger.logJobProgress(jobId, percent);
    }
  }

  /** Raised inside the transcode callback to abort work for a deleted job. */
  static final class JobVanishedException extends RuntimeException {

    JobVanishedException(String phase) {
      super(phase, null, false, false);
    }
  }
}
