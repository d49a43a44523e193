package com.scholary.videogen.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProviderTransport} on the JDK {@link HttpClient}.
 *
 * <p>Multipart bodies are assembled by hand since the JDK client has no multipart support. The
 * format is:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="key"
 *
 * value
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="image.png"
 * Content-Type: image/png
 *
 * [binary data]
 * --boundary--
 * </pre>
 */
public class JdkProviderTransport implements ProviderTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdkProviderTransport.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public JdkProviderTransport(HttpProperties properties, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    LOGGER.info("Initialized provider transport: connectTimeout={}", properties.connectTimeout());
  }

  @Override
  public JsonNode getJson(URI uri, Map<String, String> headers, Duration timeout) {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(timeout).GET();
    headers.forEach(builder::header);
    return sendForJson(builder.build());
  }

  @Override
  public JsonNode postJson(URI uri, Map<String, String> headers, JsonNode body, Duration timeout) {
    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(uri)
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
      headers.forEach(builder::header);
      return sendForJson(builder.build());
    } catch (IOException e) {
      throw new ProviderHttpException("Failed to encode request body for " + uri, e);
    }
  }

  @Override
  public void postMultipart(URI uri, List<MultipartPart> parts, Duration timeout) {
    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildMultipartBody(parts, boundary)))
            .build();
    HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
    checkStatus(response.statusCode(), response.body());
  }

  @Override
  public long download(URI uri, Path target, Duration timeout) {
    HttpRequest request = HttpRequest.newBuilder().uri(uri).timeout(timeout).GET().build();
    try {
      Files.createDirectories(target.toAbsolutePath().getParent());
      HttpResponse<Path> response = send(request, HttpResponse.BodyHandlers.ofFile(target));
      if (response.statusCode() / 100 != 2) {
        String body = Files.readString(target, StandardCharsets.UTF_8);
        Files.deleteIfExists(target);
        throw new ProviderHttpException(response.statusCode(), body);
      }
      return Files.size(target);
    } catch (IOException e) {
      throw new ProviderHttpException("Failed to write download of " + uri + " to " + target, e);
    }
  }

  private JsonNode sendForJson(HttpRequest request) {
    LOGGER.debug("{} {}", request.method(), request.uri());
    HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
    checkStatus(response.statusCode(), response.body());
    try {
      return objectMapper.readTree(response.body());
    } catch (IOException e) {
      throw new ProviderHttpException("Invalid JSON from " + request.uri(), e);
    }
  }

  private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
    try {
      return httpClient.send(request, handler);
    } catch (IOException e) {
      throw new ProviderHttpException(
          String.format("%s %s failed: %s", request.method(), request.uri(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderHttpException(request.method() + " " + request.uri() + " interrupted", e);
    }
  }

  private void checkStatus(int statusCode, byte[] body) {
    if (statusCode / 100 != 2) {
      throw new ProviderHttpException(
          statusCode, body == null ? "" : new String(body, StandardCharsets.UTF_8));
    }
  }

  static byte[] buildMultipartBody(List<MultipartPart> parts, String boundary) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (MultipartPart part : parts) {
      StringBuilder header = new StringBuilder();
      header.append("--").append(boundary).append("\r\n");
      header.append("Content-Disposition: form-data; name=\"").append(part.name()).append('"');
      if (part.isFile()) {
        header.append("; filename=\"").append(part.filename()).append('"');
      }
      header.append("\r\n");
      if (part.contentType() != null) {
        header.append("Content-Type: ").append(part.contentType()).append("\r\n");
      }
      header.append("\r\n");
      out.writeBytes(header.toString().getBytes(StandardCharsets.UTF_8));
      out.writeBytes(part.content());
      out.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));
    }
    out.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }
}
