package com.scholary.videogen.service;

/** Hands a persisted job to background execution. */
public interface TaskDispatcher {

  /**
   * Queue a job for execution.
   *
   * @return false if the job is already queued or running in this process
   * @throws java.util.concurrent.RejectedExecutionException if the queue is full
   */
  boolean dispatch(String jobId);
}
