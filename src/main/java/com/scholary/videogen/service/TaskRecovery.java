package com.scholary.videogen.service;

import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobErrorKind;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.job.JobStore;
import com.scholary.videogen.job.JobTransition;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Resolves jobs left behind by a previous process once the application is ready.
 *
 * <p>The worker queue lives in memory, so a restart loses everything queued or running. Pending
 * jobs are dispatched again. Running jobs lost their worker and are failed, since the remote task
 * they were polling cannot be resumed.
 */
@Component
public class TaskRecovery {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskRecovery.class);

  static final int MAX_RECOVERED = 10_000;
  static final String WORKER_RESTARTED = "worker restarted";

  private final JobStore jobStore;
  private final TaskDispatcher dispatcher;

  public TaskRecovery(JobStore jobStore, TaskDispatcher dispatcher) {
    this.jobStore = jobStore;
    this.dispatcher = dispatcher;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    recover();
  }

  void recover() {
    int failed = failOrphanedRunningJobs();
    int dispatched = redispatchPendingJobs();
    if (failed > 0 || dispatched > 0) {
      LOGGER.info(
          "Recovered jobs after restart: {} re-dispatched, {} failed as orphaned",
          dispatched,
          failed);
    }
  }

  private int failOrphanedRunningJobs() {
    int failed = 0;
    for (Job job : load(JobStatus.RUNNING)) {
      if (jobStore.transition(
          job.id(), JobTransition.failed(JobErrorKind.INTERNAL, WORKER_RESTARTED))) {
        LOGGER.warn("Job {} was running when the worker stopped, marked failed", job.id());
        failed++;
      }
    }
    return failed;
  }

  private int redispatchPendingJobs() {
    int dispatched = 0;
    for (Job job : load(JobStatus.PENDING)) {
      try {
        if (dispatcher.dispatch(job.id())) {
          dispatched++;
        }
      } catch (RejectedExecutionException e) {
        LOGGER.error("Worker queue full while recovering, failing job {}", job.id());
        jobStore.transition(
            job.id(), JobTransition.failed(JobErrorKind.INTERNAL, "Task queue is full"));
      }
    }
    return dispatched;
  }

  private List<Job> load(JobStatus status) {
    List<Job> jobs = jobStore.findByStatus(status, MAX_RECOVERED);
    if (jobs.size() == MAX_RECOVERED) {
      LOGGER.warn(
          "Recovery limited to the oldest {} {} jobs, the rest stay untouched",
          MAX_RECOVERED,
          status.value());
    }
    return jobs;
  }
}
