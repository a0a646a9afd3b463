package com.scholary.mp3.converter.submission;

/**
 * Thrown when a submission is rejected before any job is created: malformed or unsupported URLs,
 * or a batch outside the allowed size. The caller can fix the request and resubmit.
 */
public class InvalidSubmissionException extends RuntimeException {

  public InvalidSubmissionException(String message) {
    super(message);
  }
}
