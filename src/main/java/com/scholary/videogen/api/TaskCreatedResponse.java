package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TaskCreatedResponse(@JsonProperty("task_id") String taskId) {}
