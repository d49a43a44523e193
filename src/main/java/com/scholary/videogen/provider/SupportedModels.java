package com.scholary.videogen.provider;

import java.util.Arrays;
import java.util.List;

/** Parses configured model lists. */
public final class SupportedModels {

  private SupportedModels() {}

  /**
   * Split a comma separated list, trimming entries and dropping empty ones.
   *
   * @return the parsed list, or {@code fallback} when nothing is configured
   */
  public static List<String> parse(String commaSeparated, List<String> fallback) {
    if (commaSeparated == null || commaSeparated.isBlank()) {
      return List.copyOf(fallback);
    }
    List<String> models =
        Arrays.stream(commaSeparated.split(","))
            .map(String::trim)
            .filter(model -> !model.isEmpty())
            .distinct()
            .toList();
    return models.isEmpty() ? List.copyOf(fallback) : models;
  }
}
