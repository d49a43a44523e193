package com.scholary.videogen.provider.aliyun;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.artifact.MediaFileLocator;
import com.scholary.videogen.provider.InputStager;
import com.scholary.videogen.provider.ProviderCallException;
import com.scholary.videogen.provider.http.HttpProperties;
import com.scholary.videogen.provider.http.MultipartPart;
import com.scholary.videogen.provider.http.ProviderTransport;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Uploads input media to DashScope temporary storage.
 *
 * <p>Handshake: fetch an upload policy for the model, pull the source bytes into the local temp
 * area, then POST a signed multipart form to the policy's upload host. The object is referenced
 * as {@code oss://{upload_dir}/{file}} and stays available for 48 hours.
 */
class AliyunInputStager implements InputStager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AliyunInputStager.class);

  static final String OSS_PREFIX = "oss://";

  private final AliyunProperties properties;
  private final ProviderTransport transport;
  private final HttpProperties httpProperties;
  private final ArtifactResolver artifactResolver;

  AliyunInputStager(
      AliyunProperties properties,
      ProviderTransport transport,
      HttpProperties httpProperties,
      ArtifactResolver artifactResolver) {
    this.properties = properties;
    this.transport = transport;
    this.httpProperties = httpProperties;
    this.artifactResolver = artifactResolver;
  }

  @Override
  public boolean isNativeReference(String url) {
    return url != null && url.startsWith(OSS_PREFIX);
  }

  @Override
  public String upload(String sourceUrl, String model) {
    LOGGER.info("Uploading {} to Aliyun temporary storage", sourceUrl);
    try {
      JsonNode policy = fetchPolicy(model);
      Path file = artifactResolver.fetchToTemp(sourceUrl);
      String fileName = file.getFileName().toString();
      String key = required(policy, "upload_dir") + "/" + fileName;

      List<MultipartPart> parts =
          List.of(
              MultipartPart.field("OSSAccessKeyId", required(policy, "oss_access_key_id")),
              MultipartPart.field("Signature", required(policy, "signature")),
              MultipartPart.field("policy", required(policy, "policy")),
              MultipartPart.field("x-oss-object-acl", required(policy, "x_oss_object_acl")),
              MultipartPart.field(
                  "x-oss-forbid-overwrite", required(policy, "x_oss_forbid_overwrite")),
              MultipartPart.field("key", key),
              MultipartPart.field("success_action_status", "200"),
              MultipartPart.file("file", file, MediaFileLocator.contentType(fileName)));

      transport.postMultipart(
          URI.create(required(policy, "upload_host")), parts, httpProperties.transferTimeout());
      return OSS_PREFIX + key;
    } catch (ProviderCallException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ProviderCallException(
          ProviderCallException.Kind.INPUT_STAGING,
          "Failed to upload " + sourceUrl + " to Aliyun temporary storage: " + e.getMessage(),
          e);
    }
  }

  private JsonNode fetchPolicy(String model) {
    URI uri =
        UriComponentsBuilder.fromUriString(properties.uploadPolicyUrl())
            .queryParam("action", "getPolicy")
            .queryParam("model", model)
            .build()
            .toUri();
    JsonNode response =
        transport.getJson(
            uri,
            Map.of(
                "Authorization", "Bearer " + properties.apiKey(),
                "Content-Type", "application/json"),
            httpProperties.shortTimeout());
    JsonNode data = response.path("data");
    if (!data.isObject()) {
      throw new ProviderCallException(
          ProviderCallException.Kind.INPUT_STAGING,
          "Upload policy response has no data: " + response);
    }
    return data;
  }

  private static String required(JsonNode policy, String field) {
    String value = policy.path(field).asText("");
    if (value.isEmpty()) {
      throw new ProviderCallException(
          ProviderCallException.Kind.INPUT_STAGING, "Upload policy is missing " + field);
    }
    return value;
  }
}
