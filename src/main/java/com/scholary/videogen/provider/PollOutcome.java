package com.scholary.videogen.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A provider's poll response mapped onto the internal vocabulary.
 *
 * @param phase internal phase
 * @param payload raw poll response, kept for result formatting
 * @param code provider error code on failure
 * @param message provider error message on failure
 */
public record PollOutcome(Phase phase, JsonNode payload, String code, String message) {

  public enum Phase {
    RUNNING,
    SUCCEEDED,
    FAILED
  }

  public static PollOutcome running(JsonNode payload) {
    return new PollOutcome(Phase.RUNNING, payload, null, null);
  }

  public static PollOutcome succeeded(JsonNode payload) {
    return new PollOutcome(Phase.SUCCEEDED, payload, null, null);
  }

  public static PollOutcome failed(JsonNode payload, String code, String message) {
    return new PollOutcome(Phase.FAILED, payload, code, message);
  }
}
