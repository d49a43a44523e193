package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobStatus;
import java.time.Instant;

/**
 * One row of a task listing.
 *
 * <p>Tenant-wide listings also show who owns each task and how it was requested; those fields are
 * omitted from a user's own listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskListItem(
    @JsonProperty("task_id") String taskId,
    JobStatus status,
    String model,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("user_id") String userId,
    String provider,
    JsonNode parameters,
    @JsonProperty("is_async") Boolean async) {

  static TaskListItem forUser(Job job) {
    return new TaskListItem(
        job.id(),
        job.status(),
        job.model(),
        job.createdAt(),
        job.updatedAt(),
        null,
        null,
        null,
        null,
        null);
  }

  static TaskListItem forTenant(Job job) {
    return new TaskListItem(
        job.id(),
        job.status(),
        job.model(),
        job.createdAt(),
        job.updatedAt(),
        job.tenantId(),
        job.userId(),
        job.provider(),
        job.parameters(),
        job.async());
  }
}
