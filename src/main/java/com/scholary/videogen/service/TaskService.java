package com.scholary.videogen.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.artifact.MediaUrls;
import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobErrorKind;
import com.scholary.videogen.job.JobPage;
import com.scholary.videogen.job.JobQuery;
import com.scholary.videogen.job.JobStore;
import com.scholary.videogen.job.JobTransition;
import com.scholary.videogen.logging.StructuredLogger;
import com.scholary.videogen.provider.ProviderAdapter;
import com.scholary.videogen.provider.ProviderRegistry;
import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the job lifecycle.
 *
 * <p>Creation validates parameters before anything is persisted, so an invalid request never
 * leaves a job behind. Execution is handed to the {@link TaskDispatcher} for asynchronous jobs
 * and run inline for synchronous ones.
 *
 * <p>Cancellation is local only: the record moves to CANCELLED, remote work is left to finish, and
 * its eventual outcome is rejected by the store.
 */
@Service
public class TaskService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final ProviderRegistry providerRegistry;
  private final TaskDispatcher dispatcher;
  private final TaskWorker worker;
  private final ArtifactResolver artifactResolver;
  private final Clock clock;

  public TaskService(
      JobStore jobStore,
      ProviderRegistry providerRegistry,
      TaskDispatcher dispatcher,
      TaskWorker worker,
      ArtifactResolver artifactResolver,
      Clock clock) {
    this.jobStore = jobStore;
    this.providerRegistry = providerRegistry;
    this.dispatcher = dispatcher;
    this.worker = worker;
    this.artifactResolver = artifactResolver;
    this.clock = clock;
  }

  /**
   * Create a job and start it.
   *
   * @param provider provider name, {@code null} for the configured default
   * @return the new job id
   * @throws com.scholary.videogen.provider.ProviderNotFoundException if the provider is unknown
   * @throws com.scholary.videogen.provider.ParameterValidationException if validation fails
   */
  public String createTask(
      String tenantId,
      String userId,
      String provider,
      String model,
      JsonNode parameters,
      boolean async) {
    ProviderAdapter adapter =
        provider == null ? providerRegistry.getDefault() : providerRegistry.get(provider);
    ObjectNode normalized = adapter.validateParameters(model, parameters);

    Job job =
        jobStore.insert(
            Job.pending(
                tenantId, userId, adapter.name(), model, normalized, async, clock.instant()));
    STRUCTURED_LOGGER.logJobCreated(job.id(), adapter.name(), model, async);

    if (async) {
      try {
        dispatcher.dispatch(job.id());
      } catch (RejectedExecutionException e) {
        LOGGER.error("Worker queue full, failing job {}", job.id());
        jobStore.transition(
            job.id(), JobTransition.failed(JobErrorKind.INTERNAL, "Task queue is full"));
      }
    } else {
      LOGGER.info("Executing job {} synchronously", job.id());
      worker.executeInline(job.id());
    }
    return job.id();
  }

  /**
   * @throws TaskNotFoundException if no such job exists
   */
  public TaskStatusView getTaskStatus(String jobId) {
    Job job = load(jobId);
    return new TaskStatusView(job.id(), job.status(), job.createdAt(), job.updatedAt());
  }

  /**
   * Outcome of a job. Each downloaded video's local path is replaced by {@code file_url}, {@code
   * download_url} and {@code url}; the provider URL moves to {@code source_url}.
   *
   * @throws TaskNotFoundException if no such job exists
   */
  public TaskResultView getTaskResult(String jobId) {
    Job job = load(jobId);
    JsonNode result = job.result() == null ? null : withDisplayUrls(job.result());
    return new TaskResultView(job.id(), job.status(), result, job.error());
  }

  /**
   * Cancel a pending or running job.
   *
   * @return false if the job does not exist or is already terminal
   */
  public boolean cancelTask(String jobId) {
    boolean cancelled = jobStore.transition(jobId, JobTransition.cancelled());
    if (cancelled) {
      LOGGER.info("Cancelled job {}", jobId);
    } else {
      LOGGER.info("Job {} not cancelled: missing or already finished", jobId);
    }
    return cancelled;
  }

  public JobPage listTasks(JobQuery query) {
    return jobStore.find(query);
  }

  private Job load(String jobId) {
    return jobStore.findById(jobId).orElseThrow(() -> new TaskNotFoundException(jobId));
  }

  private JsonNode withDisplayUrls(JsonNode stored) {
    JsonNode result = stored.deepCopy();
    JsonNode videos = result.path("videos");
    if (!videos.isArray()) {
      return result;
    }
    for (JsonNode video : (ArrayNode) videos) {
      if (!video.isObject()) {
        continue;
      }
      ObjectNode node = (ObjectNode) video;
      String localPath = node.path("local_path").asText("");
      if (localPath.isEmpty()) {
        continue;
      }
      MediaUrls urls = artifactResolver.resolveDisplayUrls(localPath);
      node.put("source_url", node.path("url").asText(""));
      node.put("file_url", urls.relativeUrl());
      node.put("download_url", urls.downloadUrl());
      node.put("url", urls.absoluteUrl());
      node.remove("local_path");
    }
    return result;
  }
}
