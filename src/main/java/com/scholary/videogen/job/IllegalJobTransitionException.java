package com.scholary.videogen.job;

/** Thrown when a transition would leave a terminal state or skip the lifecycle order. */
public class IllegalJobTransitionException extends RuntimeException {

  private final JobStatus from;
  private final JobStatus to;

  public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
    super(String.format("Job %s cannot move from %s to %s", jobId, from.value(), to.value()));
    this.from = from;
    this.to = to;
  }

  public JobStatus getFrom() {
    return from;
  }

  public JobStatus getTo() {
    return to;
  }
}
