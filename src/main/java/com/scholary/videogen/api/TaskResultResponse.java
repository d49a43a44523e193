package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.service.TaskResultView;

/** Task outcome. {@code result} and {@code error} are null unless completed or failed. */
public record TaskResultResponse(
    @JsonProperty("task_id") String taskId, JobStatus status, JsonNode result, String error) {

  static TaskResultResponse from(TaskResultView view) {
    return new TaskResultResponse(view.taskId(), view.status(), view.result(), view.error());
  }
}
