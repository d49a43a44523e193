package com.scholary.videogen.provider.zhipuai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.provider.ModelKind;
import java.util.List;
import java.util.Optional;

/**
 * Model families of the video generation API and the body fields each accepts.
 *
 * <p>A request body is {@code model} plus every allowed field present in the normalized
 * parameters; anything else stays out of the request.
 */
enum ZhipuRequestShape {
  COGVIDEOX(
      ModelKind.TEXT_TO_VIDEO,
      List.of("prompt", "quality", "with_audio", "image_url", "size", "fps")),
  VIDU_TEXT(
      ModelKind.TEXT_TO_VIDEO,
      List.of("prompt", "style", "duration", "aspect_ratio", "size", "movement_amplitude")),
  VIDU_IMAGE(
      ModelKind.IMAGE_TO_VIDEO,
      List.of("image_url", "prompt", "duration", "size", "movement_amplitude", "with_audio")),
  VIDU_START_END(
      ModelKind.KEYFRAME_TO_VIDEO,
      List.of("image_url", "prompt", "duration", "size", "movement_amplitude", "with_audio")),
  VIDU_REFERENCE(
      ModelKind.REFERENCE_TO_VIDEO,
      List.of(
          "image_url",
          "prompt",
          "duration",
          "aspect_ratio",
          "size",
          "movement_amplitude",
          "with_audio"));

  private static final List<String> COMMON_FIELDS = List.of("request_id", "user_id");

  private final ModelKind kind;
  private final List<String> fields;

  ZhipuRequestShape(ModelKind kind, List<String> fields) {
    this.kind = kind;
    this.fields = fields;
  }

  ModelKind kind() {
    return kind;
  }

  static Optional<ZhipuRequestShape> classify(String model) {
    if (model.startsWith("cogvideox")) {
      return Optional.of(COGVIDEOX);
    }
    if (!model.startsWith("vidu")) {
      return Optional.empty();
    }
    if (model.endsWith("-text")) {
      return Optional.of(VIDU_TEXT);
    }
    if (model.endsWith("-image")) {
      return Optional.of(VIDU_IMAGE);
    }
    if (model.endsWith("-start-end")) {
      return Optional.of(VIDU_START_END);
    }
    if (model.endsWith("-reference")) {
      return Optional.of(VIDU_REFERENCE);
    }
    return Optional.empty();
  }

  ObjectNode body(String model, ObjectNode params) {
    ObjectNode body = JsonNodeFactory.instance.objectNode();
    body.put("model", model);
    fields.forEach(field -> copy(params, body, field));
    COMMON_FIELDS.forEach(field -> copy(params, body, field));
    return body;
  }

  private static void copy(ObjectNode from, ObjectNode to, String field) {
    JsonNode value = from.get(field);
    if (value != null && !value.isNull()) {
      to.set(field, value);
    }
  }
}
