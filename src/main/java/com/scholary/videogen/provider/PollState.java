package com.scholary.videogen.provider;

import java.time.Duration;
import java.time.Instant;

/**
 * Position in a poll loop: how many polls have been made and when the next one is due.
 */
public record PollState(int attempt, Instant nextPollAt, Instant deadline) {

  public static PollState start(Instant now, PollingPolicy policy) {
    Instant deadline = policy.hasTimeLimit() ? now.plus(policy.timeLimit()) : null;
    return new PollState(0, now.plus(policy.interval()), deadline);
  }

  /** State after a poll made at {@code now} that did not reach a terminal phase. */
  public PollState advance(Instant now, Duration interval) {
    return new PollState(attempt + 1, now.plus(interval), deadline);
  }

  /** True when no further poll may be made. */
  public boolean exhausted(PollingPolicy policy) {
    if (attempt >= policy.maxAttempts()) {
      return true;
    }
    return deadline != null && nextPollAt.isAfter(deadline);
  }
}
