package com.scholary.mp3.converter.job;

/**
 * Exception thrown when the job store backend cannot be reached or fails.
 *
 * <p>The in-memory store never throws this; substitutable backends (Redis, a database) use it to
 * report infrastructure faults. Callers propagate it; a running pipeline stops on it.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
