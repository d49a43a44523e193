package com.scholary.videogen.provider.aliyun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.provider.ModelKind;
import com.scholary.videogen.provider.ParameterValidationException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes Wanx video parameters.
 *
 * <p>Pure: no I/O, the input node is never mutated, and validating its own output returns an equal
 * node. Unknown fields pass through untouched.
 */
class AliyunParameterValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AliyunParameterValidator.class);

  static final int DEFAULT_DURATION = 5;
  static final int MIN_DURATION = 3;
  static final int MAX_DURATION = 5;
  static final String DEFAULT_RESOLUTION = "720P";

  /** Legacy {@code size} values to resolution tiers. */
  static final Map<String, String> SIZE_TO_RESOLUTION =
      Map.of(
          "1280*720", "720P",
          "720*1280", "720P",
          "960*960", "720P",
          "832*1088", "720P",
          "1088*832", "720P",
          "832*480", "480P",
          "480*832", "480P",
          "624*624", "480P");

  private final List<String> supportedModels;

  AliyunParameterValidator(List<String> supportedModels) {
    this.supportedModels = List.copyOf(supportedModels);
  }

  static ModelKind classify(String model) {
    String lower = model.toLowerCase(Locale.ROOT);
    if (lower.contains("t2v")) {
      return ModelKind.TEXT_TO_VIDEO;
    }
    if (lower.contains("i2v")) {
      return ModelKind.IMAGE_TO_VIDEO;
    }
    if (lower.contains("kf2v") || lower.contains("keyframe")) {
      return ModelKind.KEYFRAME_TO_VIDEO;
    }
    LOGGER.warn(
        "Cannot determine kind of model {}, using {}", model, ModelKind.TEXT_TO_VIDEO.value());
    return ModelKind.TEXT_TO_VIDEO;
  }

  ObjectNode validate(String model, JsonNode parameters) {
    if (!supportedModels.contains(model)) {
      throw new ParameterValidationException(
          String.format(
              "Model '%s' not supported. Supported models: %s",
              model, String.join(", ", supportedModels)));
    }
    if (parameters != null && !parameters.isNull() && !parameters.isObject()) {
      throw new ParameterValidationException("Parameters must be a JSON object");
    }

    ObjectNode validated =
        parameters == null || parameters.isNull()
            ? JsonNodeFactory.instance.objectNode()
            : ((ObjectNode) parameters).deepCopy();

    ModelKind kind = classify(model);
    validated.put("model_type", kind.value());

    if (kind != ModelKind.KEYFRAME_TO_VIDEO && !present(validated, "prompt")) {
      throw new ParameterValidationException("Missing required parameter: prompt");
    }

    JsonNode legacyImage = validated.remove("source_image");
    if (kind == ModelKind.IMAGE_TO_VIDEO) {
      if (!present(validated, "img_url") && legacyImage != null && !legacyImage.isNull()) {
        validated.set("img_url", legacyImage);
      }
      if (!present(validated, "img_url")) {
        throw new ParameterValidationException("Image-to-video model requires img_url parameter");
      }
    }

    if (kind == ModelKind.KEYFRAME_TO_VIDEO) {
      if (!present(validated, "first_frame_url")) {
        throw new ParameterValidationException(
            "Keyframe-to-video model requires first_frame_url parameter");
      }
      if (!present(validated, "last_frame_url")) {
        throw new ParameterValidationException(
            "Keyframe-to-video model requires last_frame_url parameter");
      }
    }

    validated.put("duration", normalizeDuration(kind, validated.get("duration")));

    JsonNode size = validated.remove("size");
    if (!present(validated, "resolution")) {
      String resolution =
          size == null || size.isNull()
              ? DEFAULT_RESOLUTION
              : SIZE_TO_RESOLUTION.getOrDefault(size.asText(), DEFAULT_RESOLUTION);
      validated.put("resolution", resolution);
    }

    if (!present(validated, "prompt_extend")) {
      validated.put("prompt_extend", true);
    }
    if (!present(validated, "seed")) {
      validated.put("seed", -1);
    }
    return validated;
  }

  private static int normalizeDuration(ModelKind kind, JsonNode duration) {
    if (duration == null || duration.isNull()) {
      return DEFAULT_DURATION;
    }
    if (kind == ModelKind.KEYFRAME_TO_VIDEO) {
      return DEFAULT_DURATION;
    }
    double seconds;
    if (duration.isNumber()) {
      seconds = duration.doubleValue();
    } else {
      try {
        seconds = Double.parseDouble(duration.asText().trim());
      } catch (NumberFormatException e) {
        throw new ParameterValidationException("duration must be a number: " + duration.asText());
      }
    }
    if (Double.isNaN(seconds)) {
      throw new ParameterValidationException("duration must be a number: " + duration.asText());
    }
    // clamp before narrowing, large values must not wrap
    return (int) Math.min(Math.max(seconds, MIN_DURATION), MAX_DURATION);
  }

  private static boolean present(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }
}
