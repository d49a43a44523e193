package com.scholary.videogen.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A requested state change together with the outcome it carries.
 *
 * <p>Only terminal transitions carry an outcome: COMPLETED carries a result, FAILED carries an
 * error message and kind.
 */
public record JobTransition(
    JobStatus target, JsonNode result, String error, JobErrorKind errorKind) {

  public static JobTransition running() {
    return new JobTransition(JobStatus.RUNNING, null, null, null);
  }

  public static JobTransition completed(JsonNode result) {
    return new JobTransition(JobStatus.COMPLETED, result, null, null);
  }

  public static JobTransition failed(JobErrorKind kind, String message) {
    return new JobTransition(JobStatus.FAILED, null, kind.tag(message), kind);
  }

  public static JobTransition cancelled() {
    return new JobTransition(JobStatus.CANCELLED, null, null, null);
  }
}
