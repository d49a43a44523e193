package com.scholary.videogen.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts {@code event_type} plus the event fields into MDC for exactly one log line
 * and removes them afterwards. Job-scoped keys ({@code jobId}, {@code provider}, {@code model}) are
 * owned by the worker and left alone.
 */
public class StructuredLogger {

  private static final List<String> EVENT_FIELDS =
      List.of(
          "event_type",
          "status_from",
          "status_to",
          "remote_job_id",
          "attempt",
          "remote_status",
          "source_url",
          "local_path",
          "staged_ref");

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job created event. */
  public void logJobCreated(String jobId, String provider, String model, boolean async) {
    try {
      MDC.put("event_type", "job_created");
      logger.info(
          "Job created: id={}, provider={}, model={}, async={}", jobId, provider, model, async);
    } finally {
      clearEventFields();
    }
  }

  /** Log job status change event. */
  public void logStatusChanged(String jobId, String from, String to) {
    try {
      MDC.put("event_type", "job_status_changed");
      MDC.put("status_from", from);
      MDC.put("status_to", to);
      logger.info("Job status changed: id={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log one remote poll. */
  public void logRemotePoll(String remoteJobId, int attempt, int maxAttempts, String phase) {
    try {
      MDC.put("event_type", "remote_poll");
      MDC.put("remote_job_id", remoteJobId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("remote_status", phase);
      logger.debug(
          "Remote poll: task={}, attempt={}/{}, phase={}",
          remoteJobId,
          attempt,
          maxAttempts,
          phase);
    } finally {
      clearEventFields();
    }
  }

  /** Log artifact download event. */
  public void logArtifactDownloaded(String sourceUrl, String localPath, long bytes) {
    try {
      MDC.put("event_type", "artifact_downloaded");
      MDC.put("source_url", sourceUrl);
      MDC.put("local_path", localPath);
      logger.info("Artifact downloaded: {} -> {} ({} bytes)", sourceUrl, localPath, bytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log input staging event. */
  public void logInputStaged(String sourceUrl, String stagedRef) {
    try {
      MDC.put("event_type", "input_staged");
      MDC.put("source_url", sourceUrl);
      MDC.put("staged_ref", stagedRef);
      logger.info("Input staged: {} -> {}", sourceUrl, stagedRef);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    EVENT_FIELDS.forEach(MDC::remove);
  }
}
