package com.scholary.videogen.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videogen.job.JobStatus;

/**
 * Outcome of a job. {@code result} is set only when completed and carries display URLs for each
 * downloaded video; {@code error} is set only when failed.
 */
public record TaskResultView(String taskId, JobStatus status, JsonNode result, String error) {}
