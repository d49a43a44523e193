package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope for every API response.
 *
 * <p>Success carries the payload under {@code results}; failure carries a message and a
 * machine-readable {@code error_code}, never a stack trace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    String message,
    @JsonProperty("results") T data,
    @JsonProperty("error_code") String errorCode) {

  public static <T> ApiResponse<T> ok(String message, T data) {
    return new ApiResponse<>(true, message, data, null);
  }

  public static <T> ApiResponse<T> error(String message, String errorCode) {
    return new ApiResponse<>(false, message, null, errorCode);
  }
}
