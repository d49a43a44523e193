package com.scholary.videogen.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.client.result.UpdateResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * MongoDB job store.
 *
 * <p>Jobs are schemaless documents in the {@code tasks} collection. Transitions use optimistic
 * concurrency on a {@code version} field: read, apply the lifecycle guard, then update only if the
 * version is unchanged. MongoDB's single-document atomicity is all this needs.
 */
public class MongoJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoJobStore.class);

  static final String COLLECTION = "tasks";
  private static final int MAX_WRITE_ATTEMPTS = 5;
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final MongoTemplate mongoTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
    this.mongoTemplate = mongoTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Create the listing indexes. Safe to call repeatedly. */
  public void ensureIndexes() {
    try {
      mongoTemplate
          .indexOps(COLLECTION)
          .ensureIndex(
              new Index()
                  .on("tenant_id", Sort.Direction.ASC)
                  .on("user_id", Sort.Direction.ASC)
                  .on("created_at", Sort.Direction.DESC));
      LOGGER.info("Ensured indexes on collection {}", COLLECTION);
    } catch (DataAccessException e) {
      throw new JobStoreException("Failed to create indexes on " + COLLECTION, e);
    }
  }

  @Override
  public Job insert(Job job) {
    ObjectId id = new ObjectId();
    Document document = toDocument(job);
    document.put("_id", id);
    try {
      mongoTemplate.insert(document, COLLECTION);
    } catch (DataAccessException e) {
      throw new JobStoreException("Failed to insert job", e);
    }
    return job.withId(id.toHexString());
  }

  @Override
  public Optional<Job> findById(String id) {
    if (id == null || !ObjectId.isValid(id)) {
      return Optional.empty();
    }
    try {
      Document document = mongoTemplate.findById(new ObjectId(id), Document.class, COLLECTION);
      return Optional.ofNullable(document).map(this::fromDocument);
    } catch (DataAccessException e) {
      throw new JobStoreException("Failed to read job " + id, e);
    }
  }

  @Override
  public boolean transition(String id, JobTransition transition) {
    for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
      Optional<Job> current = findById(id);
      if (current.isEmpty()) {
        return false;
      }
      Job job = current.get();
      if (!job.status().canTransitionTo(transition.target())) {
        LOGGER.debug(
            "Rejected transition for job {}: {} -> {}",
            id,
            job.status().value(),
            transition.target().value());
        return false;
      }

      Job next = job.apply(transition, clock.instant());
      Query query =
          new Query(Criteria.where("_id").is(new ObjectId(id)).and("version").is(job.version()));
      Update update =
          new Update()
              .set("status", next.status().value())
              .set("updated_at", Date.from(next.updatedAt()))
              .set("result", toValue(next.result()))
              .set("error", next.error())
              .set("error_kind", next.errorKind() == null ? null : next.errorKind().label())
              .set("version", next.version());

      try {
        UpdateResult result = mongoTemplate.updateFirst(query, update, COLLECTION);
        if (result.getMatchedCount() == 1) {
          return true;
        }
      } catch (DataAccessException e) {
        throw new JobStoreException("Failed to update job " + id, e);
      }
      LOGGER.debug("Concurrent write on job {}, retrying (attempt {})", id, attempt);
    }
    throw new JobStoreException(
        "Gave up updating job " + id + " after " + MAX_WRITE_ATTEMPTS + " concurrent writes");
  }

  @Override
  public JobPage find(JobQuery query) {
    Criteria criteria = Criteria.where("tenant_id").is(query.tenantId());
    if (query.userId() != null) {
      criteria = criteria.and("user_id").is(query.userId());
    }
    if (query.status() != null) {
      criteria = criteria.and("status").is(query.status().value());
    }
    if (query.model() != null) {
      criteria = criteria.and("model").is(query.model());
    }

    try {
      long total = mongoTemplate.count(new Query(criteria), COLLECTION);
      Query pageQuery =
          new Query(criteria)
              .with(
                  Sort.by(
                      query.sort().descending() ? Sort.Direction.DESC : Sort.Direction.ASC,
                      query.sort().field()))
              .skip(query.skip())
              .limit(query.limit());
      List<Job> items =
          mongoTemplate.find(pageQuery, Document.class, COLLECTION).stream()
              .map(this::fromDocument)
              .toList();
      return new JobPage(items, total, query.page(), query.pageSize());
    } catch (DataAccessException e) {
      throw new JobStoreException("Failed to list jobs for tenant " + query.tenantId(), e);
    }
  }

  @Override
  public List<Job> findByStatus(JobStatus status, int limit) {
    Query query =
        new Query(Criteria.where("status").is(status.value()))
            .with(Sort.by(Sort.Direction.ASC, "created_at"))
            .limit(limit);
    try {
      return mongoTemplate.find(query, Document.class, COLLECTION).stream()
          .map(this::fromDocument)
          .toList();
    } catch (DataAccessException e) {
      throw new JobStoreException("Failed to list " + status.value() + " jobs", e);
    }
  }

  private Document toDocument(Job job) {
    Document document = new Document();
    document.put("tenant_id", job.tenantId());
    document.put("user_id", job.userId());
    document.put("provider", job.provider());
    document.put("model", job.model());
    document.put("parameters", toValue(job.parameters()));
    document.put("is_async", job.async());
    document.put("status", job.status().value());
    document.put("created_at", Date.from(job.createdAt()));
    document.put("updated_at", Date.from(job.updatedAt()));
    document.put("result", toValue(job.result()));
    document.put("error", job.error());
    document.put("error_kind", job.errorKind() == null ? null : job.errorKind().label());
    document.put("version", job.version());
    return document;
  }

  private Object toValue(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isObject()) {
      return new Document(objectMapper.convertValue(node, MAP_TYPE));
    }
    return objectMapper.convertValue(node, Object.class);
  }

  private Job fromDocument(Document document) {
    JsonNode rawParameters = objectMapper.valueToTree(document.get("parameters"));
    ObjectNode parameters =
        rawParameters instanceof ObjectNode
            ? (ObjectNode) rawParameters
            : objectMapper.createObjectNode();
    Object result = document.get("result");
    String errorKind = document.getString("error_kind");
    Number version = document.get("version", Number.class);
    return new Job(
        document.getObjectId("_id").toHexString(),
        document.getString("tenant_id"),
        document.getString("user_id"),
        document.getString("provider"),
        document.getString("model"),
        parameters,
        document.getBoolean("is_async", true),
        JobStatus.fromValue(document.getString("status")),
        toInstant(document.getDate("created_at")),
        toInstant(document.getDate("updated_at")),
        result == null ? null : objectMapper.valueToTree(result),
        document.getString("error"),
        errorKind == null ? null : JobErrorKind.fromLabel(errorKind),
        version == null ? 0L : version.longValue());
  }

  private Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }
}
