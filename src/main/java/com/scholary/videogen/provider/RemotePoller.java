package com.scholary.videogen.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videogen.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a remote job to a terminal phase by polling.
 *
 * <p>The loop is an explicit state machine over {@link PollState}: wait until the next poll is
 * due, poll, then either finish or advance. Waiting goes through a {@link Sleeper} and time is
 * read from a {@link Clock}, so the loop runs instantly under test.
 *
 * <p>Responses are acted on strictly in the order received. Interrupting the polling thread ends
 * the loop.
 */
public class RemotePoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemotePoller.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final PollingPolicy policy;
  private final Sleeper sleeper;
  private final Clock clock;

  public RemotePoller(PollingPolicy policy, Sleeper sleeper, Clock clock) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public PollingPolicy policy() {
    return policy;
  }

  /**
   * Poll until the remote job succeeds.
   *
   * @param remoteJobId provider-assigned id, used for logging and error messages
   * @param check one poll, mapping the provider's response to a {@link PollOutcome}
   * @return the payload of the successful poll
   * @throws ProviderCallException {@code REMOTE_CALL} when the provider reports failure, {@code
   *     REMOTE_TIMEOUT} when the ceiling is reached first
   */
  public JsonNode await(String remoteJobId, Function<String, PollOutcome> check) {
    PollState state = PollState.start(clock.instant(), policy);

    while (!state.exhausted(policy)) {
      waitUntil(state.nextPollAt(), remoteJobId);

      PollOutcome outcome = check.apply(remoteJobId);
      STRUCTURED_LOGGER.logRemotePoll(
          remoteJobId, state.attempt() + 1, policy.maxAttempts(), outcome.phase().name());

      switch (outcome.phase()) {
        case SUCCEEDED:
          LOGGER.info("Remote task {} succeeded after {} polls", remoteJobId, state.attempt() + 1);
          return outcome.payload();
        case FAILED:
          throw new ProviderCallException(
              ProviderCallException.Kind.REMOTE_CALL,
              String.format("Task failed: %s - %s", outcome.code(), outcome.message()));
        default:
          state = state.advance(clock.instant(), policy.interval());
      }
    }

    LOGGER.warn("Remote task {} not finished after {} polls", remoteJobId, state.attempt());
    throw new ProviderCallException(
        ProviderCallException.Kind.REMOTE_TIMEOUT,
        String.format(
            "Task %s did not complete within %d polls", remoteJobId, state.attempt()));
  }

  private void waitUntil(Instant due, String remoteJobId) {
    Duration wait = Duration.between(clock.instant(), due);
    if (wait.isNegative() || wait.isZero()) {
      return;
    }
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL, "Polling interrupted for task " + remoteJobId, e);
    }
  }
}
