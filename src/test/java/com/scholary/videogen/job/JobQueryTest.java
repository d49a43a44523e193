package com.scholary.videogen.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobQueryTest {

  @Test
  void computesOffsetFromPage() {
    JobQuery query = new JobQuery("t1", "u1", null, null, 3, 20, null);

    assertThat(query.skip()).isEqualTo(40);
    assertThat(query.limit()).isEqualTo(20);
    assertThat(query.sort()).hasToString("-created_at");
    assertThat(query.tenantWide()).isFalse();
  }

  @Test
  void rejectsOutOfRangePaging() {
    assertThatThrownBy(() -> new JobQuery("t1", null, null, null, 0, 20, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new JobQuery("t1", null, null, null, 1, 101, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parsesOrdering() {
    assertThat(JobSort.parse("created_at").descending()).isFalse();
    assertThat(JobSort.parse("-updated_at")).isEqualTo(new JobSort("updated_at", true));
    assertThat(JobSort.parse(null)).isEqualTo(new JobSort("created_at", true));
    assertThatThrownBy(() -> JobSort.parse("-secret"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("secret");
  }

  @Test
  void pageArithmetic() {
    assertThat(new JobPage(List.of(), 0, 1, 20).totalPages()).isEqualTo(1);
    JobPage middle = new JobPage(List.of(), 45, 2, 20);
    assertThat(middle.totalPages()).isEqualTo(3);
    assertThat(middle.hasNext()).isTrue();
    assertThat(middle.hasPrevious()).isTrue();
    assertThat(new JobPage(List.of(), 45, 3, 20).hasNext()).isFalse();
  }

  private static Job job(String model, Instant createdAt) {
    return Job.pending(
        "t1", "u1", "aliyun", model, JsonNodeFactory.instance.objectNode(), true, createdAt);
  }

  @Test
  void comparatorsOrderByTheirField() {
    Instant t0 = Instant.parse("2025-03-01T10:00:00Z");
    Job b = job("b-model", t0);
    Job a = job("a-model", t0.plusSeconds(5));
    Job none = job(null, t0.plusSeconds(10));
    List<Job> jobs = List.of(b, a, none);

    assertThat(jobs.stream().sorted(JobSort.parse("model").comparator()).toList())
        .containsExactly(none, a, b);
    assertThat(jobs.stream().sorted(JobSort.parse("-model").comparator()).toList())
        .containsExactly(b, a, none);
    assertThat(jobs.stream().sorted(JobSort.parse("-created_at").comparator()).toList())
        .containsExactly(none, a, b);
    assertThat(jobs.stream().sorted(JobSort.parse("updated_at").comparator()).toList())
        .containsExactly(b, a, none);
  }
}
