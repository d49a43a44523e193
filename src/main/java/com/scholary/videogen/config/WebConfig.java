package com.scholary.videogen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.security.CallerContextInterceptor;
import com.scholary.videogen.security.RoutePermissionTable;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the caller interceptor on the API routes and serves generated videos under the media
 * path. Staged inputs in the temp area are never exposed.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final VideoGenProperties properties;
  private final ArtifactResolver artifactResolver;
  private final ObjectMapper objectMapper;

  public WebConfig(
      VideoGenProperties properties, ArtifactResolver artifactResolver, ObjectMapper objectMapper) {
    this.properties = properties;
    this.artifactResolver = artifactResolver;
    this.objectMapper = objectMapper;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(
            new CallerContextInterceptor(
                RoutePermissionTable.defaults(), properties.auth(), objectMapper))
        .addPathPatterns("/api/**");
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    String basePath = properties.media().basePath();
    String location = artifactResolver.videosDir().toUri().toString();
    if (!location.endsWith("/")) {
      location = location + "/";
    }
    registry.addResourceHandler(basePath + "/**").addResourceLocations(location);
  }
}
