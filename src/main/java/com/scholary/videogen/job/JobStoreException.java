package com.scholary.videogen.job;

/**
 * Thrown when the persistence layer fails.
 *
 * <p>Callers in the middle of a job's lifecycle log this and leave the job at its last known good
 * state instead of crashing the worker.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
