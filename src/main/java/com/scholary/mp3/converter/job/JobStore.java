package com.scholary.mp3.converter.job;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for conversion jobs.
 *
 * <p>All operations are atomic with respect to each other. A concurrent {@link #update} and
 * {@link #get} never observe a torn record.
 *
 * <p>Implementations may throw {@link JobStoreException} when their backend is unreachable.
 */
public interface JobStore {

  /**
   * Create a new job for the given reference in the PENDING state.
   *
   * @param sourceUrl the media reference
   * @return the full created record
   */
  ConversionJob create(String sourceUrl);

  Optional<ConversionJob> get(long id);

  /** All jobs, most recently created first. */
  List<ConversionJob> list();

  /**
   * Merge a patch into an existing job.
   *
   * <p>Returns empty if the job does not exist. That is not an error: callers treat it as "the job
   * vanished, stop processing".
   *
   * @throws IllegalJobTransitionException if the patch breaks the job lifecycle
   */
  Optional<ConversionJob> update(long id, JobPatch patch);

  /**
   * Remove a job record.
   *
   * @return true if a record existed and was removed
   */
  boolean delete(long id);

  /**
   * Remove a job record, returning the snapshot that was removed.
   *
   * <p>The snapshot is the last state written before the removal, so it reflects any update that
   * won a race against the delete.
   */
  Optional<ConversionJob> remove(long id);

  List<ConversionJob> listByStatus(JobStatus status);
}
