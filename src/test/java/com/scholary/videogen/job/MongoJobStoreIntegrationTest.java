package com.scholary.videogen.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the Mongo job store against a real MongoDB.
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

  @Container static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

  private static MongoClient client;
  private MongoTemplate template;
  private MongoJobStore store;

  @BeforeAll
  static void connect() {
    client = MongoClients.create(mongo.getReplicaSetUrl());
  }

  @AfterAll
  static void disconnect() {
    client.close();
  }

  @BeforeEach
  void setUp() {
    template = new MongoTemplate(client, "video_service_test");
    template.dropCollection("tasks");
    store = new MongoJobStore(template, MAPPER, Clock.fixed(T0.plusSeconds(60), ZoneOffset.UTC));
    store.ensureIndexes();
  }

  private Job insert(String user, String model, Instant createdAt) {
    ObjectNode params = MAPPER.createObjectNode().put("prompt", "a cat").put("duration", 5);
    return store.insert(Job.pending("t1", user, "aliyun", model, params, true, createdAt));
  }

  @Test
  void insertedJobRoundTripsThroughTheCollection() {
    Job job = insert("u1", "wanx2.1-t2v-turbo", T0);

    Job found = store.findById(job.id()).orElseThrow();

    assertThat(found.status()).isEqualTo(JobStatus.PENDING);
    assertThat(found.tenantId()).isEqualTo("t1");
    assertThat(found.parameters().path("prompt").asText()).isEqualTo("a cat");
    assertThat(found.createdAt()).isEqualTo(T0);
    assertThat(found.version()).isZero();
  }

  @Test
  void malformedIdIsNotFound() {
    assertThat(store.findById("not-an-object-id")).isEmpty();
  }

  @Test
  void transitionsAreGuardedAndVersioned() {
    Job job = insert("u1", "m1", T0);
    ObjectNode result = MAPPER.createObjectNode().put("id", "remote-1");

    assertThat(store.transition(job.id(), JobTransition.running())).isTrue();
    assertThat(store.transition(job.id(), JobTransition.completed(result))).isTrue();
    assertThat(store.transition(job.id(), JobTransition.cancelled())).isFalse();

    Job stored = store.findById(job.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(stored.result().path("id").asText()).isEqualTo("remote-1");
    assertThat(stored.version()).isEqualTo(2);
    assertThat(stored.updatedAt()).isAfter(stored.createdAt());
  }

  @Test
  void failedJobKeepsErrorKind() {
    Job job = insert("u1", "m1", T0);

    store.transition(job.id(), JobTransition.failed(JobErrorKind.INPUT_STAGING, "no policy"));

    Job stored = store.findById(job.id()).orElseThrow();
    assertThat(stored.error()).isEqualTo("InputStaging: no policy");
    assertThat(stored.errorKind()).isEqualTo(JobErrorKind.INPUT_STAGING);
  }

  @Test
  void findCountsAndPages() {
    for (int i = 0; i < 5; i++) {
      insert("u1", "m" + i, T0.plusSeconds(i));
    }
    insert("u2", "m9", T0.plusSeconds(10));

    JobPage page = store.find(new JobQuery("t1", "u1", null, null, 2, 2, null));
    JobPage tenant = store.find(new JobQuery("t1", null, null, null, 1, 10, null));

    assertThat(page.total()).isEqualTo(5);
    assertThat(page.items()).extracting(Job::model).containsExactly("m2", "m1");
    assertThat(tenant.total()).isEqualTo(6);
  }

  @Test
  void findByStatusSpansTenants() {
    Job first = insert("u1", "m1", T0);
    Job other =
        store.insert(
            Job.pending(
                "t2", "u9", "aliyun", "m2", MAPPER.createObjectNode(), true, T0.plusSeconds(5)));
    Job running = insert("u1", "m3", T0.plusSeconds(1));
    store.transition(running.id(), JobTransition.running());

    assertThat(store.findByStatus(JobStatus.PENDING, 10))
        .extracting(Job::id)
        .containsExactly(first.id(), other.id());
    assertThat(store.findByStatus(JobStatus.RUNNING, 10))
        .extracting(Job::id)
        .containsOnly(running.id());
  }
}
