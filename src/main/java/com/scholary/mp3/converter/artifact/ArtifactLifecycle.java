package com.scholary.mp3.converter.artifact;

import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the link between a job and its stored MP3.
 *
 * <p>Deleting a job removes the record atomically and then the artifact named by the removed
 * snapshot (best effort). A pipeline that finishes after the removal finds no record and discards
 * its own output. A missing file is not an error at delete time.
 */
@Service
public class ArtifactLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactLifecycle.class);

  private final JobStore jobStore;
  private final ArtifactStorage artifactStorage;

  public ArtifactLifecycle(JobStore jobStore, ArtifactStorage artifactStorage) {
    this.jobStore = jobStore;
    this.artifactStorage = artifactStorage;
  }

  /**
   * Delete a job and its artifact.
   *
   * @return true if a job record existed
   */
  public boolean delete(long jobId) {
    Optional<ConversionJob> removed = jobStore.remove(jobId);
    removed.ifPresent(this::removeArtifact);
    LOGGER.info("Delete job: id={}, existed={}", jobId, removed.isPresent());
    return removed.isPresent();
  }

  /** Remove the artifact behind a job, logging instead of propagating failures. */
  public void removeArtifact(ConversionJob job) {
    if (job.artifactKey() != null) {
      discard(job.artifactKey());
    }
  }

  /** Remove an artifact by key, logging instead of propagating failures. */
  public void discard(String artifactKey) {
    try {
      artifactStorage.remove(artifactKey);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to remove artifact {}", artifactKey, e);
    }
  }
}
