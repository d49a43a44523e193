package com.scholary.videogen.service;

import com.scholary.videogen.job.JobStatus;
import java.time.Instant;

/** Lifecycle position of a job. */
public record TaskStatusView(
    String taskId, JobStatus status, Instant createdAt, Instant updatedAt) {}
