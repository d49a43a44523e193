package com.scholary.videogen.provider.zhipuai;

import com.scholary.videogen.provider.SupportedModels;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the ZhipuAI BigModel video API. */
@ConfigurationProperties(prefix = "providers.zhipuai")
@Validated
public record ZhipuAiProperties(
    String apiKey, @NotBlank String apiUrl, @NotBlank String resultUrl, String supportedModels) {

  static final List<String> DEFAULT_MODELS =
      List.of(
          "cogvideox-2",
          "cogvideox-flash",
          "viduq1-text",
          "viduq1-image",
          "viduq1-start-end",
          "vidu2-image",
          "vidu2-start-end",
          "vidu2-reference");

  public List<String> supportedModelList() {
    return SupportedModels.parse(supportedModels, DEFAULT_MODELS);
  }
}
