package com.scholary.videogen.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs jobs on the bounded worker pool.
 *
 * <p>Keeps the ids of queued and running jobs so a second dispatch of the same job is dropped
 * while the first is in flight. Across processes, the store's transition guard keeps duplicate
 * executions from corrupting a job.
 */
@Component
public class ExecutorTaskDispatcher implements TaskDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTaskDispatcher.class);

  private final Executor executor;
  private final TaskWorker worker;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public ExecutorTaskDispatcher(@Qualifier("taskExecutor") Executor executor, TaskWorker worker) {
    this.executor = executor;
    this.worker = worker;
  }

  @Override
  public boolean dispatch(String jobId) {
    if (!inFlight.add(jobId)) {
      LOGGER.info("Job {} is already in flight, ignoring duplicate dispatch", jobId);
      return false;
    }
    try {
      executor.execute(
          () -> {
            try {
              worker.execute(jobId);
            } finally {
              inFlight.remove(jobId);
            }
          });
      LOGGER.debug("Dispatched job {}", jobId);
      return true;
    } catch (RejectedExecutionException e) {
      inFlight.remove(jobId);
      throw e;
    }
  }

  boolean isInFlight(String jobId) {
    return inFlight.contains(jobId);
  }
}
