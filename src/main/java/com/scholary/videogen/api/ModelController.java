package com.scholary.videogen.api;

import com.scholary.videogen.provider.ProviderRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Enumerates the registered providers and their models. */
@RestController
@RequestMapping("/api/models")
@Tag(name = "Models", description = "Supported providers and models")
public class ModelController {

  private final ProviderRegistry providerRegistry;

  public ModelController(ProviderRegistry providerRegistry) {
    this.providerRegistry = providerRegistry;
  }

  @GetMapping
  @Operation(summary = "Models by provider")
  public ApiResponse<Map<String, List<String>>> getSupportedModels() {
    return ApiResponse.ok("Supported models retrieved", providerRegistry.supportedModels());
  }

  @GetMapping("/all")
  @Operation(summary = "All models", description = "Flat list over every provider")
  public ApiResponse<Map<String, List<String>>> getAllModels() {
    List<String> models =
        providerRegistry.supportedModels().values().stream().flatMap(List::stream).toList();
    return ApiResponse.ok("All models retrieved", Map.of("models", models));
  }

  @GetMapping("/by-provider/{providerName}")
  @Operation(summary = "Models of one provider")
  public ApiResponse<Map<String, List<String>>> getProviderModels(
      @PathVariable String providerName) {
    List<String> models = providerRegistry.get(providerName).supportedModels();
    return ApiResponse.ok(
        "Models of provider " + providerName + " retrieved", Map.of(providerName, models));
  }
}
