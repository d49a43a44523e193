package com.scholary.videogen.provider.zhipuai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.provider.CanonicalResult;
import com.scholary.videogen.provider.MediaDescriptor;
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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for ZhipuAI BigModel video models (CogVideoX and Vidu).
 *
 * <p>Image inputs are public URLs sent as-is; this API has no staging handshake. Results are
 * polled from {@code async-result/{id}} and every produced video is downloaded under {@code
 * videos/zhipuai}.
 */
public class ZhipuAiProviderAdapter implements ProviderAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZhipuAiProviderAdapter.class);

  public static final String NAME = "zhipuai";

  private static final List<String> VIDEO_ATTRIBUTES = List.of("duration", "size", "fps");

  private final ZhipuAiProperties properties;
  private final ProviderTransport transport;
  private final HttpProperties httpProperties;
  private final ArtifactResolver artifactResolver;
  private final RemotePoller poller;
  private final Clock clock;
  private final ZhipuAiParameterValidator validator;

  public ZhipuAiProviderAdapter(
      ZhipuAiProperties properties,
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
    this.validator = new ZhipuAiParameterValidator(properties.supportedModelList());
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
          ProviderCallException.Kind.REMOTE_CALL, "ZhipuAI API key not configured");
    }
    Map<String, String> headers = Map.of("Authorization", "Bearer " + apiKey);

    ObjectNode body = validator.shapeOf(model).body(model, params);
    LOGGER.info("Calling ZhipuAI video model: model={}, url={}", model, properties.apiUrl());
    LOGGER.debug("ZhipuAI request body: {}", body);

    JsonNode created;
    try {
      created =
          transport.postJson(
              URI.create(properties.apiUrl()), headers, body, httpProperties.longTimeout());
    } catch (ProviderHttpException e) {
      throw remoteCallError(e);
    }

    String taskId = created.path("id").asText("");
    if (taskId.isEmpty()) {
      LOGGER.error("No id in ZhipuAI response: {}", created);
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL,
          "Failed to get task_id from response: " + created);
    }
    LOGGER.info("Created ZhipuAI async task {}", taskId);

    JsonNode finished = poller.await(taskId, id -> poll(id, headers));
    return formatResult(model, finished, params);
  }

  private PollOutcome poll(String taskId, Map<String, String> headers) {
    JsonNode response;
    try {
      response =
          transport.getJson(
              URI.create(properties.resultUrl() + "/" + taskId),
              headers,
              httpProperties.shortTimeout());
    } catch (ProviderHttpException e) {
      throw remoteCallError(e);
    }

    String status = response.path("task_status").asText("");
    if ("SUCCESS".equals(status)) {
      return PollOutcome.succeeded(response);
    }
    if ("FAIL".equals(status)) {
      JsonNode error = response.path("error");
      return PollOutcome.failed(
          response,
          error.path("code").asText("Unknown error code"),
          error.path("message").asText("Unknown error"));
    }
    if (!"PROCESSING".equals(status)) {
      LOGGER.warn("Unknown ZhipuAI task status for {}: {}", taskId, status);
    }
    return PollOutcome.running(response);
  }

  private CanonicalResult formatResult(String model, JsonNode response, ObjectNode params) {
    JsonNode results = response.path("video_result");
    if (!results.isArray() || results.isEmpty()) {
      LOGGER.error("No video results in ZhipuAI response: {}", response);
      throw new ProviderCallException(
          ProviderCallException.Kind.REMOTE_CALL, "Failed to find video results in response");
    }

    List<MediaDescriptor> videos = new ArrayList<>();
    for (int index = 0; index < results.size(); index++) {
      JsonNode result = results.get(index);
      String videoUrl = result.path("url").asText("");
      if (videoUrl.isEmpty()) {
        LOGGER.warn("Empty video URL for video {}", index);
        continue;
      }

      Path destination = artifactResolver.newArtifactPath(NAME, index, ".mp4");
      String localPath = artifactResolver.download(videoUrl, destination);

      ObjectNode metadata = JsonNodeFactory.instance.objectNode();
      metadata.put("cover_image_url", result.path("cover_image_url").asText(""));
      for (String attribute : VIDEO_ATTRIBUTES) {
        if (params.has(attribute)) {
          metadata.set(attribute, params.get(attribute));
        }
      }
      videos.add(new MediaDescriptor(index, videoUrl, localPath, metadata));
    }

    ObjectNode extras = JsonNodeFactory.instance.objectNode();
    Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!"model".equals(field.getKey())) {
        extras.set(field.getKey(), field.getValue());
      }
    }

    String id = response.path("request_id").asText("");
    return new CanonicalResult(
        id.isEmpty() ? UUID.randomUUID().toString() : id,
        response.path("model").asText(model),
        clock.instant(),
        videos,
        extras);
  }

  private static ProviderCallException remoteCallError(ProviderHttpException e) {
    String message =
        e.getStatusCode() > 0
            ? String.format(
                "ZhipuAI API HTTP error: %d, %s", e.getStatusCode(), e.getResponseBody())
            : "ZhipuAI API error: " + e.getMessage();
    LOGGER.error(message);
    return new ProviderCallException(ProviderCallException.Kind.REMOTE_CALL, message, e);
  }
}
