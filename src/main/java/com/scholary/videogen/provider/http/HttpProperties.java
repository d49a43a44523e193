package com.scholary.videogen.provider.http;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Timeouts for calls to provider APIs.
 *
 * <p>Short timeouts cover polling and policy fetches, long ones cover generation submissions, and
 * transfer timeouts cover media uploads and downloads.
 */
@ConfigurationProperties(prefix = "http")
@Validated
public record HttpProperties(
    @Positive int connectTimeoutSeconds,
    @Positive int shortTimeoutSeconds,
    @Positive int longTimeoutSeconds,
    @Positive int transferTimeoutSeconds) {

  public Duration connectTimeout() {
    return Duration.ofSeconds(connectTimeoutSeconds);
  }

  public Duration shortTimeout() {
    return Duration.ofSeconds(shortTimeoutSeconds);
  }

  public Duration longTimeout() {
    return Duration.ofSeconds(longTimeoutSeconds);
  }

  public Duration transferTimeout() {
    return Duration.ofSeconds(transferTimeoutSeconds);
  }
}
