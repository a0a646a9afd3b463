package com.scholary.mp3.converter.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle states of a conversion job.
 *
 * <p>Jobs only ever move forward: PENDING to PROCESSING, then to exactly one of COMPLETED or
 * FAILED. A job may also fail straight from PENDING when it could not be scheduled.
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return switch (this) {
      case PENDING, PROCESSING -> false;
      case COMPLETED, FAILED -> true;
    };
  }

  /**
   * Whether a job in this state may be moved to {@code next}. Restating a non-terminal state is
   * allowed so progress-only patches can carry the current status.
   */
  public boolean canTransitionTo(JobStatus next) {
    return switch (this) {
      case PENDING -> next == PENDING || next == PROCESSING || next == FAILED;
      case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobStatus fromWireName(String value) {
    return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
