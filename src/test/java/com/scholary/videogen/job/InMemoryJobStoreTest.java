package com.scholary.videogen.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryJobStoreTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

  private InMemoryJobStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryJobStore(Clock.fixed(T0, ZoneOffset.UTC));
  }

  private Job insert(String tenant, String user, String model, Instant createdAt) {
    return store.insert(
        Job.pending(tenant, user, "aliyun", model, MAPPER.createObjectNode(), true, createdAt));
  }

  @Test
  void insertAssignsIdAndFindReturnsIt() {
    Job job = insert("t1", "u1", "m1", T0);

    assertThat(job.id()).isNotBlank();
    assertThat(store.findById(job.id())).contains(job);
    assertThat(store.findById("missing")).isEmpty();
    assertThat(store.findById(null)).isEmpty();
  }

  @Test
  void transitionFollowsLifecycle() {
    Job job = insert("t1", "u1", "m1", T0);

    assertThat(store.transition(job.id(), JobTransition.running())).isTrue();
    assertThat(store.transition(job.id(), JobTransition.completed(MAPPER.createObjectNode())))
        .isTrue();
    assertThat(store.transition(job.id(), JobTransition.cancelled())).isFalse();

    Job stored = store.findById(job.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(stored.version()).isEqualTo(2);
  }

  @Test
  void cancelledJobDropsLateOutcome() {
    Job job = insert("t1", "u1", "m1", T0);
    store.transition(job.id(), JobTransition.running());
    store.transition(job.id(), JobTransition.cancelled());

    boolean written =
        store.transition(job.id(), JobTransition.failed(JobErrorKind.REMOTE_CALL, "boom"));

    assertThat(written).isFalse();
    Job stored = store.findById(job.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(stored.error()).isNull();
  }

  @Test
  void transitionOfUnknownJobReturnsFalse() {
    assertThat(store.transition("nope", JobTransition.running())).isFalse();
  }

  @Test
  void concurrentTerminalWritesHaveExactlyOneWinner() throws Exception {
    Job job = insert("t1", "u1", "m1", T0);
    store.transition(job.id(), JobTransition.running());
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger winners = new AtomicInteger();
    try {
      List<Future<?>> futures =
          IntStream.range(0, 16)
              .<Future<?>>mapToObj(
                  i ->
                      pool.submit(
                          () -> {
                            start.await();
                            JobTransition transition =
                                i % 2 == 0
                                    ? JobTransition.cancelled()
                                    : JobTransition.completed(MAPPER.createObjectNode());
                            if (store.transition(job.id(), transition)) {
                              winners.incrementAndGet();
                            }
                            return null;
                          }))
              .toList();
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(winners.get()).isEqualTo(1);
    assertThat(store.findById(job.id()).orElseThrow().version()).isEqualTo(2);
  }

  @Test
  void findFiltersByTenantUserStatusAndModel() {
    insert("t1", "u1", "m1", T0);
    Job second = insert("t1", "u1", "m2", T0.plusSeconds(1));
    insert("t1", "u2", "m1", T0.plusSeconds(2));
    insert("t2", "u1", "m1", T0.plusSeconds(3));
    store.transition(second.id(), JobTransition.running());

    assertThat(store.find(new JobQuery("t1", "u1", null, null, 1, 20, null)).total())
        .isEqualTo(2);
    assertThat(store.find(new JobQuery("t1", null, null, null, 1, 20, null)).total())
        .isEqualTo(3);
    assertThat(store.find(new JobQuery("t1", null, null, "m1", 1, 20, null)).total())
        .isEqualTo(2);
    JobPage running = store.find(new JobQuery("t1", null, JobStatus.RUNNING, null, 1, 20, null));
    assertThat(running.items()).extracting(Job::id).containsExactly(second.id());
  }

  @Test
  void findPagesNewestFirstByDefault() {
    for (int i = 0; i < 5; i++) {
      insert("t1", "u1", "m" + i, T0.plusSeconds(i));
    }

    JobPage first = store.find(new JobQuery("t1", "u1", null, null, 1, 2, null));
    JobPage last = store.find(new JobQuery("t1", "u1", null, null, 3, 2, null));

    assertThat(first.total()).isEqualTo(5);
    assertThat(first.totalPages()).isEqualTo(3);
    assertThat(first.items()).extracting(Job::model).containsExactly("m4", "m3");
    assertThat(last.items()).extracting(Job::model).containsExactly("m0");
  }

  @Test
  void findHonoursAscendingOrder() {
    insert("t1", "u1", "b", T0.plusSeconds(1));
    insert("t1", "u1", "a", T0);

    JobPage page =
        store.find(new JobQuery("t1", "u1", null, null, 1, 10, JobSort.parse("created_at")));

    assertThat(page.items()).extracting(Job::model).containsExactly("a", "b");
  }

  @Test
  void findByStatusSpansTenantsOldestFirst() {
    Job newer = insert("t2", "u2", "m2", T0.plusSeconds(30));
    Job older = insert("t1", "u1", "m1", T0);
    Job running = insert("t1", "u1", "m3", T0.plusSeconds(10));
    store.transition(running.id(), JobTransition.running());

    assertThat(store.findByStatus(JobStatus.PENDING, 10))
        .extracting(Job::id)
        .containsExactly(older.id(), newer.id());
    assertThat(store.findByStatus(JobStatus.PENDING, 1))
        .extracting(Job::id)
        .containsOnly(older.id());
    assertThat(store.findByStatus(JobStatus.RUNNING, 10))
        .extracting(Job::id)
        .containsOnly(running.id());
  }
}
