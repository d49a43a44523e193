package com.scholary.videogen.provider.zhipuai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.provider.ParameterValidationException;
import java.util.List;

/** Normalizes CogVideoX and Vidu parameters. Pure and idempotent. */
class ZhipuAiParameterValidator {

  static final int MAX_REFERENCE_IMAGES = 3;

  private final List<String> supportedModels;

  ZhipuAiParameterValidator(List<String> supportedModels) {
    this.supportedModels = List.copyOf(supportedModels);
  }

  ZhipuRequestShape shapeOf(String model) {
    return ZhipuRequestShape.classify(model)
        .orElseThrow(
            () ->
                new ParameterValidationException(
                    "Cannot determine the model family of '" + model + "'"));
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

    ZhipuRequestShape shape = shapeOf(model);
    validated.put("model_type", shape.kind().value());
    JsonNode legacyImage = validated.remove("source_image");

    if (shape == ZhipuRequestShape.COGVIDEOX) {
      requirePrompt(validated, "Parameter 'prompt' is required for CogVideoX models");
    } else if (shape == ZhipuRequestShape.VIDU_TEXT) {
      requirePrompt(validated, "Parameter 'prompt' is required for text-to-video models");
    } else if (shape == ZhipuRequestShape.VIDU_IMAGE) {
      if (!present(validated, "image_url") && legacyImage != null && !legacyImage.isNull()) {
        validated.set("image_url", legacyImage);
      }
      JsonNode image = validated.get("image_url");
      if (image == null || image.isNull()) {
        throw new ParameterValidationException(
            "Parameter 'image_url' is required for image-to-video models");
      }
      if (image.isArray() && image.isEmpty()) {
        throw new ParameterValidationException("'image_url' must not be an empty list");
      }
    } else if (shape == ZhipuRequestShape.VIDU_START_END) {
      JsonNode images = validated.get("image_url");
      if (images == null || !images.isArray() || images.size() != 2) {
        throw new ParameterValidationException(
            "Parameter 'image_url' must be a list containing exactly 2 images for start-end"
                + " frame models");
      }
    } else if (shape == ZhipuRequestShape.VIDU_REFERENCE) {
      JsonNode images = validated.get("image_url");
      if (images == null || !images.isArray() || images.isEmpty()) {
        throw new ParameterValidationException(
            "Parameter 'image_url' must be a non-empty list of images for reference model");
      }
      if (images.size() > MAX_REFERENCE_IMAGES) {
        throw new ParameterValidationException(
            "Parameter 'image_url' can contain at most 3 images for reference model");
      }
    }
    return validated;
  }

  private static void requirePrompt(ObjectNode validated, String message) {
    if (!present(validated, "prompt")) {
      throw new ParameterValidationException(message);
    }
  }

  private static boolean present(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }
}
