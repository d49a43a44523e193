package com.scholary.videogen.provider.aliyun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.provider.ModelKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Request shapes of the video synthesis API, one entry per model kind.
 *
 * <p>Builds {@code {"model", "input", "parameters"}} from normalized parameters without side
 * effects.
 */
final class AliyunRequestBodies {

  /** Fields holding input media that must be staged in provider storage first. */
  static final Map<ModelKind, List<String>> STAGED_FIELDS = new EnumMap<>(ModelKind.class);

  /** Fills {@code input} from normalized parameters. */
  private static final Map<ModelKind, BiConsumer<ObjectNode, ObjectNode>> INPUT_SHAPES =
      new EnumMap<>(ModelKind.class);

  static {
    STAGED_FIELDS.put(ModelKind.TEXT_TO_VIDEO, List.of());
    STAGED_FIELDS.put(ModelKind.IMAGE_TO_VIDEO, List.of("img_url"));
    STAGED_FIELDS.put(ModelKind.KEYFRAME_TO_VIDEO, List.of("first_frame_url", "last_frame_url"));

    INPUT_SHAPES.put(
        ModelKind.TEXT_TO_VIDEO,
        (params, input) -> {
          copy(params, input, "prompt");
          copy(params, input, "negative_prompt");
        });
    INPUT_SHAPES.put(
        ModelKind.IMAGE_TO_VIDEO,
        (params, input) -> {
          input.put("prompt", params.path("prompt").asText(""));
          copy(params, input, "img_url");
        });
    INPUT_SHAPES.put(
        ModelKind.KEYFRAME_TO_VIDEO,
        (params, input) -> {
          copy(params, input, "prompt");
          copy(params, input, "first_frame_url");
          copy(params, input, "last_frame_url");
          input.put("function", "image_reference");
        });
  }

  private AliyunRequestBodies() {}

  static List<String> stagedFields(ModelKind kind) {
    return STAGED_FIELDS.getOrDefault(kind, List.of());
  }

  static ObjectNode build(String model, ModelKind kind, ObjectNode params) {
    BiConsumer<ObjectNode, ObjectNode> inputShape = INPUT_SHAPES.get(kind);
    if (inputShape == null) {
      throw new IllegalArgumentException("No Aliyun request shape for " + kind.value());
    }

    ObjectNode body = JsonNodeFactory.instance.objectNode();
    body.put("model", model);
    inputShape.accept(params, body.putObject("input"));

    ObjectNode parameters = body.putObject("parameters");
    copy(params, parameters, "resolution");
    copy(params, parameters, "duration");
    copy(params, parameters, "prompt_extend");
    JsonNode seed = params.get("seed");
    if (seed != null && seed.isNumber() && seed.longValue() > 0) {
      parameters.set("seed", seed);
    }
    if (kind == ModelKind.KEYFRAME_TO_VIDEO) {
      copy(params, parameters, "obj_or_bg");
    }
    return body;
  }

  private static void copy(ObjectNode from, ObjectNode to, String field) {
    JsonNode value = from.get(field);
    if (value != null && !value.isNull()) {
      to.set(field, value);
    }
  }
}
