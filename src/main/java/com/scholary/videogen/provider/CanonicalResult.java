package com.scholary.videogen.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;

/**
 * Provider-agnostic output of a completed generation.
 *
 * <p>{@code extras} holds pass-through fields (original prompt, resolution, usage) that callers may
 * need; they are flattened into the top level of the JSON form.
 */
public record CanonicalResult(
    String id, String model, Instant created, List<MediaDescriptor> videos, ObjectNode extras) {

  public CanonicalResult {
    videos = List.copyOf(videos);
  }

  public ObjectNode toJson(ObjectMapper objectMapper) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", id);
    node.put("model", model);
    node.put("created", created.toString());
    ArrayNode array = node.putArray("videos");
    videos.forEach(video -> array.add(video.toJson(objectMapper)));
    if (extras != null) {
      extras.fields().forEachRemaining(e -> node.putIfAbsent(e.getKey(), e.getValue()));
    }
    return node;
  }
}
