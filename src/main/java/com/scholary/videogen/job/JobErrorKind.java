package com.scholary.videogen.job;

import com.fasterxml.jackson.annotation.JsonValue;

/** Classifies why a job failed so operators can tell a stuck remote job from a rejected one. */
public enum JobErrorKind {
  VALIDATION("Validation"),
  PROVIDER_NOT_FOUND("ProviderNotFound"),
  INPUT_STAGING("InputStaging"),
  REMOTE_CALL("RemoteCall"),
  TIMEOUT("Timeout"),
  INTERNAL("Internal");

  private final String label;

  JobErrorKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Prefixes a message with this kind's label, e.g. {@code "Timeout: task 42 still running"}. */
  public String tag(String message) {
    return label + ": " + (message == null ? "unknown error" : message);
  }

  public static JobErrorKind fromLabel(String label) {
    for (JobErrorKind kind : values()) {
      if (kind.label.equals(label) || kind.name().equals(label)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown job error kind: " + label);
  }
}
