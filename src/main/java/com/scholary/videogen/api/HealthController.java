package com.scholary.videogen.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthController {

  private final String serviceName;

  public HealthController(@Value("${spring.application.name}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check")
  public ApiResponse<Map<String, String>> health() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "UP");
    return ApiResponse.ok("Service is healthy", body);
  }
}
