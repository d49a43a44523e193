package com.scholary.videogen.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP operations the provider adapters and the artifact resolver need.
 *
 * <p>Every method throws {@link ProviderHttpException} on a non-2xx response or an I/O failure.
 */
public interface ProviderTransport {

  JsonNode getJson(URI uri, Map<String, String> headers, Duration timeout);

  JsonNode postJson(URI uri, Map<String, String> headers, JsonNode body, Duration timeout);

  void postMultipart(URI uri, List<MultipartPart> parts, Duration timeout);

  /**
   * Stream the body of a GET to {@code target}, replacing any existing file.
   *
   * @return number of bytes written
   */
  long download(URI uri, Path target, Duration timeout);
}
