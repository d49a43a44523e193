package com.scholary.videogen.service;

/** No job exists under the requested id. */
public class TaskNotFoundException extends RuntimeException {

  private final String jobId;

  public TaskNotFoundException(String jobId) {
    super("Task not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
