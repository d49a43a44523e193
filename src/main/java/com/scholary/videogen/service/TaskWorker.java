package com.scholary.videogen.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobErrorKind;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.job.JobStore;
import com.scholary.videogen.job.JobStoreException;
import com.scholary.videogen.job.JobTransition;
import com.scholary.videogen.logging.StructuredLogger;
import com.scholary.videogen.provider.CanonicalResult;
import com.scholary.videogen.provider.ParameterValidationException;
import com.scholary.videogen.provider.ProviderCallException;
import com.scholary.videogen.provider.ProviderNotFoundException;
import com.scholary.videogen.provider.ProviderRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Executes one job: mark it running, call the provider adapter, record the outcome.
 *
 * <p>The RUNNING write is best-effort. A failure to record it is logged and execution carries on,
 * since the terminal write is the one that matters. Exactly one terminal write is attempted; if
 * the store rejects it (the job was cancelled meanwhile) the outcome is dropped.
 *
 * <p>{@code jobId}, {@code provider} and {@code model} are in MDC for the whole execution and are
 * removed afterwards.
 */
@Component
public class TaskWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskWorker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final ProviderRegistry providerRegistry;
  private final ObjectMapper objectMapper;

  public TaskWorker(
      JobStore jobStore, ProviderRegistry providerRegistry, ObjectMapper objectMapper) {
    this.jobStore = jobStore;
    this.providerRegistry = providerRegistry;
    this.objectMapper = objectMapper;
  }

  /** Background execution: every failure ends up in the job record, nothing is thrown. */
  public void execute(String jobId) {
    try {
      run(jobId, false);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error executing job {}", jobId, e);
    }
  }

  /**
   * Synchronous execution: the outcome is recorded, then adapter errors are rethrown to the
   * caller.
   */
  public void executeInline(String jobId) {
    run(jobId, true);
  }

  private void run(String jobId, boolean propagate) {
    Optional<Job> found = jobStore.findById(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job {} not found, nothing to execute", jobId);
      if (propagate) {
        throw new TaskNotFoundException(jobId);
      }
      return;
    }
    Job job = found.get();
    if (job.status() != JobStatus.PENDING) {
      LOGGER.info("Job {} is {}, skipping execution", jobId, job.status().value());
      return;
    }

    MDC.put("jobId", jobId);
    MDC.put("provider", job.provider());
    MDC.put("model", job.model());
    try {
      if (!markRunning(job)) {
        return;
      }

      JobTransition outcome;
      RuntimeException failure = null;
      try {
        CanonicalResult result =
            providerRegistry.get(job.provider()).call(job.model(), job.parameters());
        outcome = JobTransition.completed(result.toJson(objectMapper));
      } catch (RuntimeException e) {
        failure = e;
        JobErrorKind kind = classify(e);
        LOGGER.error("Job {} failed ({}): {}", jobId, kind.label(), e.getMessage());
        outcome = JobTransition.failed(kind, e.getMessage());
      }

      recordOutcome(job, outcome);
      if (propagate && failure != null) {
        throw failure;
      }
    } finally {
      MDC.remove("jobId");
      MDC.remove("provider");
      MDC.remove("model");
    }
  }

  /**
   * Claim the job by moving it to RUNNING.
   *
   * <p>A rejected move means another worker claimed the job or it already finished, and this
   * worker backs off. Only a store failure is tolerated: the terminal write still decides.
   *
   * @return false when the job is no longer this worker's to run
   */
  private boolean markRunning(Job job) {
    try {
      if (jobStore.transition(job.id(), JobTransition.running())) {
        STRUCTURED_LOGGER.logStatusChanged(
            job.id(), JobStatus.PENDING.value(), JobStatus.RUNNING.value());
        return true;
      }
      Optional<Job> current = jobStore.findById(job.id());
      if (current.isPresent() && current.get().status() == JobStatus.PENDING) {
        LOGGER.warn("Job {} still pending after a rejected claim, continuing", job.id());
        return true;
      }
      LOGGER.info(
          "Job {} is {} before execution, skipping",
          job.id(),
          current.map(found -> found.status().value()).orElse("gone"));
      return false;
    } catch (JobStoreException e) {
      LOGGER.warn("Failed to mark job {} running, continuing: {}", job.id(), e.getMessage());
      return true;
    }
  }

  private void recordOutcome(Job job, JobTransition outcome) {
    try {
      if (jobStore.transition(job.id(), outcome)) {
        STRUCTURED_LOGGER.logStatusChanged(
            job.id(), JobStatus.RUNNING.value(), outcome.target().value());
      } else {
        LOGGER.warn(
            "Discarded {} outcome of job {}: job already in a terminal state",
            outcome.target().value(),
            job.id());
      }
    } catch (JobStoreException e) {
      LOGGER.error(
          "Failed to record {} outcome of job {}, leaving last known state",
          outcome.target().value(),
          job.id(),
          e);
    }
  }

  static JobErrorKind classify(RuntimeException e) {
    if (e instanceof ProviderCallException) {
      return ((ProviderCallException) e).getKind().errorKind();
    }
    if (e instanceof ParameterValidationException) {
      return JobErrorKind.VALIDATION;
    }
    if (e instanceof ProviderNotFoundException) {
      return JobErrorKind.PROVIDER_NOT_FOUND;
    }
    return JobErrorKind.INTERNAL;
  }
}
