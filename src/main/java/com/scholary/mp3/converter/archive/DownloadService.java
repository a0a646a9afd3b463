package com.scholary.mp3.converter.archive;

import com.scholary.mp3.converter.artifact.ArtifactNotFoundException;
import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobStatus;
import com.scholary.mp3.converter.job.JobStore;
import java.io.InputStream;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Single-file downloads of completed conversions. */
@Service
public class DownloadService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadService.class);

  static final String FALLBACK_FILE_NAME = "audio.mp3";

  private final JobStore jobStore;
  private final ArtifactStorage artifactStorage;

  public DownloadService(JobStore jobStore, ArtifactStorage artifactStorage) {
    this.jobStore = jobStore;
    this.artifactStorage = artifactStorage;
  }

  /**
   * Open the artifact of a completed job.
   *
   * @return empty if the job is absent, not completed, or its file no longer exists
   */
  public Optional<ArtifactDownload> open(long jobId) {
    Optional<ConversionJob> job = jobStore.get(jobId).filter(DownloadService::isDownloadable);
    if (job.isEmpty()) {
      return Optional.empty();
    }
    try {
      InputStream content = artifactStorage.openRead(job.get().artifactKey());
      return Optional.of(
          new ArtifactDownload(fileNameOf(job.get()), job.get().fileSize(), content));
    } catch (ArtifactNotFoundException e) {
      LOGGER.warn("Artifact for job {} no longer exists: {}", jobId, job.get().artifactKey());
      return Optional.empty();
    }
  }

  static boolean isDownloadable(ConversionJob job) {
    return job.status() == JobStatus.COMPLETED && job.hasArtifact();
  }

  static String fileNameOf(ConversionJob job) {
    return job.fileName() != null ? job.fileName() : FALLBACK_FILE_NAME;
  }
}
