package com.scholary.videogen.provider;

import java.time.Duration;

/**
 * How a remote job is polled.
 *
 * @param interval wait before each poll
 * @param maxAttempts poll ceiling
 * @param timeLimit wall-clock ceiling for the whole loop, {@code Duration.ZERO} for none
 */
public record PollingPolicy(Duration interval, int maxAttempts, Duration timeLimit) {

  public PollingPolicy {
    if (interval == null || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be >= 0");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    timeLimit = timeLimit == null ? Duration.ZERO : timeLimit;
  }

  public boolean hasTimeLimit() {
    return !timeLimit.isZero() && !timeLimit.isNegative();
  }
}
