package com.scholary.videogen.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the video task service.
 *
 * <p>Controls the default provider and model, the managed data root, polling limits, the download
 * cache, media URL mapping, the worker pool and caller authentication.
 */
@ConfigurationProperties(prefix = "videogen")
@Validated
public record VideoGenProperties(
    @NotBlank String defaultProvider,
    @NotBlank String defaultModel,
    @NotBlank String dataDir,
    @PositiveOrZero long taskTimeLimitSeconds,
    @NotNull @Valid PollingProperties polling,
    @NotNull @Valid CacheProperties cache,
    @NotNull @Valid MediaProperties media,
    @NotNull @Valid WorkerProperties worker,
    @NotNull @Valid AuthProperties auth) {

  public record PollingProperties(@PositiveOrZero int intervalSeconds, @Positive int maxAttempts) {}

  public record CacheProperties(
      @Positive int ttlHours, @Positive long maxSize, @Positive long sweepIntervalMillis) {}

  public record MediaProperties(
      @NotBlank String basePath, @NotBlank String downloadBaseUrl, String publicBaseUrl) {}

  public record WorkerProperties(@Positive int threads, @Positive int queueCapacity) {}

  public record AuthProperties(boolean enabled, @NotBlank String defaultTenant) {}
}
