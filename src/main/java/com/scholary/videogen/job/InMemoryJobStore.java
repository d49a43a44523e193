package com.scholary.videogen.job;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory job store.
 *
 * <p>Backed by a {@link ConcurrentHashMap}; {@code compute} gives the per-record atomicity the
 * transition guard needs. Nothing is ever evicted, so this is meant for single-node deployments
 * and tests. Use the Mongo store when jobs must survive a restart.
 */
public class InMemoryJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobStore.class);

  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJobStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Job insert(Job job) {
    Job stored = job.withId(UUID.randomUUID().toString().replace("-", ""));
    jobs.put(stored.id(), stored);
    return stored;
  }

  @Override
  public Optional<Job> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(jobs.get(id));
  }

  @Override
  public boolean transition(String id, JobTransition transition) {
    if (id == null) {
      return false;
    }
    AtomicBoolean applied = new AtomicBoolean(false);
    jobs.computeIfPresent(
        id,
        (key, current) -> {
          if (!current.status().canTransitionTo(transition.target())) {
            LOGGER.debug(
                "Rejected transition for job {}: {} -> {}",
                id,
                current.status().value(),
                transition.target().value());
            return current;
          }
          applied.set(true);
          return current.apply(transition, clock.instant());
        });
    return applied.get();
  }

  @Override
  public JobPage find(JobQuery query) {
    Predicate<Job> filter = job -> Objects.equals(job.tenantId(), query.tenantId());
    if (query.userId() != null) {
      filter = filter.and(job -> query.userId().equals(job.userId()));
    }
    if (query.status() != null) {
      filter = filter.and(job -> job.status() == query.status());
    }
    if (query.model() != null) {
      filter = filter.and(job -> query.model().equals(job.model()));
    }

    List<Job> matching = jobs.values().stream().filter(filter).toList();
    List<Job> page =
        matching.stream()
            .sorted(query.sort().comparator())
            .skip(query.skip())
            .limit(query.limit())
            .toList();
    return new JobPage(page, matching.size(), query.page(), query.pageSize());
  }

  @Override
  public List<Job> findByStatus(JobStatus status, int limit) {
    return jobs.values().stream()
        .filter(job -> job.status() == status)
        .sorted(Comparator.comparing(Job::createdAt))
        .limit(limit)
        .toList();
  }
}
