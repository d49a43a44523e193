package com.scholary.videogen.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * A persisted request for one video generation.
 *
 * <p>Immutable: every state change produces a new instance through {@link #apply}. The {@code
 * version} counter increments on every write so stores can detect concurrent writers.
 *
 * <p>Invariants: {@code result} is present only when COMPLETED, {@code error} only when FAILED,
 * and {@code updatedAt} strictly increases on every write.
 */
public record Job(
    String id,
    String tenantId,
    String userId,
    String provider,
    String model,
    ObjectNode parameters,
    boolean async,
    JobStatus status,
    Instant createdAt,
    Instant updatedAt,
    JsonNode result,
    String error,
    JobErrorKind errorKind,
    long version) {

  /** User id recorded for jobs created with tenant/system-level credentials. */
  public static final String SYSTEM_USER = "system";

  public static Job pending(
      String tenantId,
      String userId,
      String provider,
      String model,
      ObjectNode parameters,
      boolean async,
      Instant now) {
    Instant created = now.truncatedTo(ChronoUnit.MILLIS);
    return new Job(
        null,
        tenantId,
        userId == null || userId.isBlank() ? SYSTEM_USER : userId,
        provider,
        model,
        parameters,
        async,
        JobStatus.PENDING,
        created,
        created,
        null,
        null,
        null,
        0L);
  }

  public Job withId(String newId) {
    return new Job(
        newId,
        tenantId,
        userId,
        provider,
        model,
        parameters,
        async,
        status,
        createdAt,
        updatedAt,
        result,
        error,
        errorKind,
        version);
  }

  /**
   * Applies a transition and returns the new state.
   *
   * @throws IllegalJobTransitionException if the lifecycle does not allow the move
   */
  public Job apply(JobTransition transition, Instant now) {
    if (!status.canTransitionTo(transition.target())) {
      throw new IllegalJobTransitionException(id, status, transition.target());
    }
    JobStatus target = transition.target();
    return new Job(
        id,
        tenantId,
        userId,
        provider,
        model,
        parameters,
        async,
        target,
        createdAt,
        nextTimestamp(now),
        target == JobStatus.COMPLETED ? transition.result() : null,
        target == JobStatus.FAILED ? transition.error() : null,
        target == JobStatus.FAILED ? transition.errorKind() : null,
        version + 1);
  }

  private Instant nextTimestamp(Instant now) {
    Instant candidate = now.truncatedTo(ChronoUnit.MILLIS);
    return candidate.isAfter(updatedAt) ? candidate : updatedAt.plusMillis(1);
  }
}
