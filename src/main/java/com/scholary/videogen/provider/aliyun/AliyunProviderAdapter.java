package com.scholary.videogen.provider.aliyun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.provider.CanonicalResult;
import com.scholary.videogen.provider.MediaDescriptor;
import com.scholary.videogen.provider.ModelKind;
import com.scholary.videogen.provider.PollOutcome;
import com.scholary.videogen.provider.ProviderAdapter;
import com.scholary.videogen.provider.ProviderCallException;
import com.scholary.videogen.provider.RemotePoller;
import com.scholary.videogen.provider.http.HttpProperties;
import com.scholary.videogen.provider.http.ProviderHttpException;
import com.scholary.videogen.provider.http.ProviderTransport;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for Aliyun DashScope Wanx video models (text-to-video, image-to-video and first/last
 * frame to video).
 *
 * <p>Generation is asynchronous on the provider side: the creation call returns a task id which is
 * polled until it reaches a terminal status. Image inputs are staged in DashScope temporary
 * storage before submission, and the resulting video is downloaded under {@code videos/aliyun}.
 */
public class AliyunProviderAdapter implements ProviderAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AliyunProviderAdapter.class);

  public static final String NAME = "aliyun";

  static final Set<String> SUCCESS_STATUSES = Set.of("SUCCEEDED", "SUCCESS", "COMPLETE");
  static final Set<String> FAILURE_STATUSES = Set.of("FAILED", "CANCELLED", "ERROR");

  private final AliyunProperties properties;
  private final ProviderTransport transport;
  private final HttpProperties httpProperties;
  private final ArtifactResolver artifactResolver;
  private final RemotePoller poller;
  private final Clock clock;
  private final AliyunParameterValidator validator;
  private final AliyunInputStager stager;

  public AliyunProviderAdapter(
      AliyunProperties properties,
      ProviderTransport transport,
      HttpProperties httpProperties,
      ArtifactResolver artifactResolver,
      RemotePoller poller,
      Clock clock) {
    this.properties = properties;
    this.transport = transport;
    this.httpProperties = httpProperties;
    this.artifactResolver = artifactResolver;
    this.poller = poller;
    this.clock = clock;
    this.validator = new AliyunParameterValidator(properties.supportedModelList());
    this.stager = new AliyunInputStager(properties, transport, httpProperties, artifactResolver);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<String> supportedModels() {
    return properties.supportedModelList();
  }

  @Override
  public ObjectNode validateParameters(String model, JsonNode parameters) {
    return validator.validate(model, parameters);
  }

  @Override
  public CanonicalResult call(String model, JsonNode parameters) {
    ObjectNode params = validator.validate(model, parameters);
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL, "Aliyun API key not configured");
    }

    ModelKind kind = AliyunParameterValidator.classify(model);
    for (String field : AliyunRequestBodies.stagedFields(kind)) {
      String url = params.path(field).asText("");
      if (!url.isEmpty()) {
        params.put(field, artifactResolver.ensureStaged(url, model, stager));
      }
    }

    ObjectNode body = AliyunRequestBodies.build(model, kind, params);
    String endpoint =
        kind == ModelKind.KEYFRAME_TO_VIDEO ? properties.keyframeApiUrl() : properties.apiUrl();
    LOGGER.info(
        "Calling Aliyun video model: model={}, kind={}, url={}", model, kind.value(), endpoint);
    LOGGER.debug("Aliyun request body: {}", body);

    JsonNode created;
    try {
      created =
          transport.postJson(
              URI.create(endpoint),
              Map.of(
                  "Authorization", "Bearer " + apiKey,
                  "X-DashScope-Async", "enable",
                  "X-DashScope-OssResourceResolve", "enable"),
              body,
              httpProperties.longTimeout());
    } catch (ProviderHttpException e) {
      throw remoteCallError(e);
    }

    String taskId = created.path("output").path("task_id").asText("");
    if (taskId.isEmpty()) {
      LOGGER.error("No task_id in Aliyun response: {}", created);
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL,
          "Failed to get task_id from response: " + created);
    }
    LOGGER.info("Created Aliyun async task {}", taskId);

    JsonNode finished = poller.await(taskId, id -> poll(id, apiKey));
    return formatResult(model, finished, params);
  }

  private PollOutcome poll(String taskId, String apiKey) {
    JsonNode response;
    try {
      response =
          transport.getJson(
              URI.create(properties.taskUrl() + "/" + taskId),
              Map.of("Authorization", "Bearer " + apiKey),
              httpProperties.shortTimeout());
    } catch (ProviderHttpException e) {
      throw remoteCallError(e);
    }

    JsonNode output = response.path("output");
    String status = output.path("task_status").asText("");
    if (SUCCESS_STATUSES.contains(status)) {
      return PollOutcome.succeeded(response);
    }
    if (FAILURE_STATUSES.contains(status)) {
      return PollOutcome.failed(
          response,
          output.path("code").asText("Unknown error code"),
          output.path("message").asText("Unknown error"));
    }
    return PollOutcome.running(response);
  }

  private CanonicalResult formatResult(String model, JsonNode response, ObjectNode params) {
    JsonNode output = response.path("output");
    String videoUrl = output.path("video_url").asText("");
    if (videoUrl.isEmpty()) {
      LOGGER.error("No video URL in Aliyun response: {}", response);
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL, "Failed to find video URL in response");
    }

    Path destination = artifactResolver.newArtifactPath(NAME, 0, ".mp4");
    String localPath = artifactResolver.download(videoUrl, destination);

    ObjectNode metadata = JsonNodeFactory.instance.objectNode();
    metadata.set("duration", params.path("duration"));
    MediaDescriptor video = new MediaDescriptor(0, videoUrl, localPath, metadata);

    ObjectNode extras = JsonNodeFactory.instance.objectNode();
    if (params.hasNonNull("prompt")) {
      extras.set("prompt", params.get("prompt"));
    }
    if (output.hasNonNull("actual_prompt")) {
      extras.set("actual_prompt", output.get("actual_prompt"));
    }
    extras.set("model_type", params.path("model_type"));
    if (params.hasNonNull("resolution")) {
      extras.set("resolution", params.get("resolution"));
    }
    if (response.hasNonNull("usage")) {
      extras.set("usage", response.get("usage"));
    }

    String id = response.path("request_id").asText("");
    return new CanonicalResult(
        id.isEmpty() ? UUID.randomUUID().toString() : id,
        model,
        clock.instant(),
        List.of(video),
        extras);
  }

  private static ProviderCallException remoteCallError(ProviderHttpException e) {
    String message =
        e.getStatusCode() > 0
            ? String.format(
                "Aliyun API HTTP error: %d, %s", e.getStatusCode(), e.getResponseBody())
            : "Aliyun API error: " + e.getMessage();
    LOGGER.error(message);
    return new ProviderCallException(ProviderCallException.Kind.REMOTE_CALL, message, e);
  }
}
