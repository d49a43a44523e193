package com.scholary.videogen.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Instant T0 = Instant.parse("2025-03-01T10:00:00.123456Z");

  private Job pending() {
    ObjectNode params = MAPPER.createObjectNode().put("prompt", "a cat");
    return Job.pending("t1", "u1", "aliyun", "wanx2.1-t2v-turbo", params, true, T0).withId("j1");
  }

  @Test
  void pendingJobStartsAtVersionZeroWithEqualTimestamps() {
    Job job = pending();

    assertThat(job.status()).isEqualTo(JobStatus.PENDING);
    assertThat(job.version()).isZero();
    assertThat(job.createdAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00.123Z"));
    assertThat(job.updatedAt()).isEqualTo(job.createdAt());
    assertThat(job.result()).isNull();
    assertThat(job.error()).isNull();
  }

  @Test
  void blankUserIsRecordedAsSystem() {
    Job job = Job.pending("t1", " ", "aliyun", "m", MAPPER.createObjectNode(), false, T0);

    assertThat(job.userId()).isEqualTo(Job.SYSTEM_USER);
  }

  @Test
  void updatedAtStrictlyIncreasesEvenWhenClockStandsStill() {
    Job running = pending().apply(JobTransition.running(), T0);
    Job done = running.apply(JobTransition.completed(MAPPER.createObjectNode()), T0);

    assertThat(running.updatedAt()).isAfter(running.createdAt());
    assertThat(done.updatedAt()).isAfter(running.updatedAt());
    assertThat(done.version()).isEqualTo(2);
  }

  @Test
  void failedTransitionCarriesTaggedErrorAndNoResult() {
    Job failed =
        pending()
            .apply(JobTransition.failed(JobErrorKind.TIMEOUT, "still running"), T0.plusSeconds(5));

    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.error()).isEqualTo("Timeout: still running");
    assertThat(failed.errorKind()).isEqualTo(JobErrorKind.TIMEOUT);
    assertThat(failed.result()).isNull();
  }

  @Test
  void completedTransitionCarriesResultAndNoError() {
    ObjectNode result = MAPPER.createObjectNode().put("id", "r1");

    Job done = pending().apply(JobTransition.completed(result), T0.plusSeconds(5));

    assertThat(done.result()).isEqualTo(result);
    assertThat(done.error()).isNull();
    assertThat(done.errorKind()).isNull();
  }

  @Test
  void terminalJobRejectsFurtherTransitions() {
    Job cancelled = pending().apply(JobTransition.cancelled(), T0.plusSeconds(1));

    assertThatThrownBy(
            () -> cancelled.apply(JobTransition.completed(MAPPER.createObjectNode()), T0))
        .isInstanceOf(IllegalJobTransitionException.class);
  }
}
