package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Request to create a video generation task.
 *
 * <p>A missing provider or model falls back to the configured defaults; {@code is_async} defaults
 * to true. Parameters are provider specific and validated by the provider's adapter.
 */
public record CreateTaskRequest(
    String provider,
    String model,
    JsonNode parameters,
    @JsonProperty("is_async") Boolean async) {

  public CreateTaskRequest {
    if (parameters == null || parameters.isNull()) {
      parameters = JsonNodeFactory.instance.objectNode();
    }
    if (async == null) {
      async = true;
    }
  }
}
