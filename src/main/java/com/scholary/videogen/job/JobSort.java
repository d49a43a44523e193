package com.scholary.videogen.job;

import java.util.Comparator;
import java.util.Map;
import java.util.function.Function;

/**
 * Ordering for job listings, parsed from strings such as {@code "-created_at"}.
 *
 * <p>A leading {@code '-'} means descending. Field names are the persisted (snake_case) names.
 */
public record JobSort(String field, boolean descending) {

  public static final String DEFAULT = "-created_at";

  private static final Map<String, Comparator<Job>> SORT_KEYS =
      Map.of(
          "created_at", by(Job::createdAt),
          "updated_at", by(Job::updatedAt),
          "status", by(job -> job.status().value()),
          "model", by(Job::model),
          "provider", by(Job::provider));

  public JobSort {
    if (!SORT_KEYS.containsKey(field)) {
      throw new IllegalArgumentException(
          "Unsupported ordering field: " + field + ". Supported: " + SORT_KEYS.keySet());
    }
  }

  public static JobSort parse(String ordering) {
    if (ordering == null || ordering.isBlank()) {
      ordering = DEFAULT;
    }
    String trimmed = ordering.trim();
    if (trimmed.startsWith("-")) {
      return new JobSort(trimmed.substring(1), true);
    }
    return new JobSort(trimmed, false);
  }

  public Comparator<Job> comparator() {
    Comparator<Job> comparator = SORT_KEYS.get(field);
    return descending ? comparator.reversed() : comparator;
  }

  private static <U extends Comparable<? super U>> Comparator<Job> by(Function<Job, U> key) {
    return Comparator.comparing(key, Comparator.nullsFirst(Comparator.naturalOrder()));
  }

  @Override
  public String toString() {
    return (descending ? "-" : "") + field;
  }
}
