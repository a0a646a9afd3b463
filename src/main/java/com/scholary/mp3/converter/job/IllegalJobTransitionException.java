package com.scholary.mp3.converter.job;

/**
 * Thrown when a patch would break the job lifecycle: a backwards status move, a move out of a
 * terminal state, or a second write to a write-once field.
 */
public class IllegalJobTransitionException extends IllegalStateException {

  public IllegalJobTransitionException(long jobId, JobStatus from, JobStatus to) {
    super(String.format("Job %d cannot move from %s to %s", jobId, from, to));
  }

  public IllegalJobTransitionException(String message) {
    super(message);
  }
}
