package com.scholary.videogen.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a generation job.
 *
 * <pre>
 * PENDING --dispatch--> RUNNING --success--> COMPLETED
 * PENDING --dispatch--> RUNNING --failure--> FAILED
 * {PENDING, RUNNING} --cancel--> CANCELLED
 * </pre>
 *
 * <p>A terminal write straight from PENDING is accepted too: recording RUNNING is best-effort, so a
 * worker whose RUNNING write was lost must still be able to finish the job.
 */
public enum JobStatus {
  PENDING("pending"),
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed"),
  CANCELLED("cancelled");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean canTransitionTo(JobStatus target) {
    if (this == PENDING) {
      return target == RUNNING || target.isTerminal();
    }
    if (this == RUNNING) {
      return target.isTerminal();
    }
    return false;
  }

  @JsonCreator
  public static JobStatus fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Job status must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (JobStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }
}
