package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.service.TaskStatusView;
import java.time.Instant;

public record TaskStatusResponse(
    @JsonProperty("task_id") String taskId,
    JobStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  static TaskStatusResponse from(TaskStatusView view) {
    return new TaskStatusResponse(view.taskId(), view.status(), view.createdAt(), view.updatedAt());
  }
}
