package com.scholary.videogen.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One produced media file.
 *
 * @param index position in the provider's output
 * @param url remote source URL
 * @param localPath downloaded copy, empty when the download failed
 * @param metadata provider-specific fields passed through verbatim (duration, size, cover image)
 */
public record MediaDescriptor(int index, String url, String localPath, ObjectNode metadata) {

  public MediaDescriptor {
    localPath = localPath == null ? "" : localPath;
  }

  public ObjectNode toJson(ObjectMapper objectMapper) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("index", index);
    node.put("url", url);
    node.put("local_path", localPath);
    if (metadata != null) {
      metadata.fields().forEachRemaining(e -> node.putIfAbsent(e.getKey(), e.getValue()));
    }
    return node;
  }
}
