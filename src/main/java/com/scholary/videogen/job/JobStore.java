package com.scholary.videogen.job;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for jobs.
 *
 * <p>Implementations rely on the backing store's single-record atomic update; there are no
 * multi-job transactions. Jobs are never deleted here, retention is handled outside this service.
 */
public interface JobStore {

  /**
   * Persist a new job.
   *
   * @param job the job to insert, its id is ignored
   * @return the stored job with its assigned id
   * @throws JobStoreException if the write fails
   */
  Job insert(Job job);

  /**
   * Look up a job by id.
   *
   * @param id the job id
   * @return the job, or empty if it does not exist or the id is malformed
   */
  Optional<Job> findById(String id);

  /**
   * Atomically apply a lifecycle transition.
   *
   * <p>The transition is guarded by {@link JobStatus#canTransitionTo}: a job that is already
   * terminal (CANCELLED included) is left untouched.
   *
   * @param id the job id
   * @param transition the requested transition
   * @return true if the job was updated, false if it does not exist or the guard rejected the move
   * @throws JobStoreException if the write fails
   */
  boolean transition(String id, JobTransition transition);

  /**
   * Count all jobs matching the query and return the requested page.
   *
   * @param query filter, ordering and page
   * @return the page and the total count
   * @throws JobStoreException if the read fails
   */
  JobPage find(JobQuery query);

  /**
   * Jobs in one status across all tenants, oldest first.
   *
   * @param status the status to match
   * @param limit maximum number of jobs returned
   * @throws JobStoreException if the read fails
   */
  List<Job> findByStatus(JobStatus status, int limit);
}
