package com.scholary.videogen.provider.aliyun;

import com.scholary.videogen.provider.SupportedModels;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Aliyun DashScope video API.
 *
 * <p>{@code apiKey} may be blank at startup; calls then fail with a clear message.
 */
@ConfigurationProperties(prefix = "providers.aliyun")
@Validated
public record AliyunProperties(
    String apiKey,
    @NotBlank String apiUrl,
    @NotBlank String keyframeApiUrl,
    @NotBlank String taskUrl,
    @NotBlank String uploadPolicyUrl,
    String supportedModels) {

  static final List<String> DEFAULT_MODELS =
      List.of(
          "wanx2.1-t2v-turbo",
          "wanx2.1-t2v-plus",
          "wanx2.1-i2v-turbo",
          "wanx2.1-i2v-plus",
          "wanx2.1-kf2v-plus");

  public List<String> supportedModelList() {
    return SupportedModels.parse(supportedModels, DEFAULT_MODELS);
  }
}
