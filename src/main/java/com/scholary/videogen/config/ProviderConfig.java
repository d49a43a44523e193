package com.scholary.videogen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.provider.PollingPolicy;
import com.scholary.videogen.provider.ProviderRegistry;
import com.scholary.videogen.provider.RemotePoller;
import com.scholary.videogen.provider.Sleeper;
import com.scholary.videogen.provider.aliyun.AliyunProperties;
import com.scholary.videogen.provider.aliyun.AliyunProviderAdapter;
import com.scholary.videogen.provider.http.HttpProperties;
import com.scholary.videogen.provider.http.JdkProviderTransport;
import com.scholary.videogen.provider.http.ProviderTransport;
import com.scholary.videogen.provider.zhipuai.ZhipuAiProperties;
import com.scholary.videogen.provider.zhipuai.ZhipuAiProviderAdapter;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the provider adapters and the registry that routes tasks to them.
 *
 * <p>The registry is built once here and never changes afterwards.
 */
@Configuration
public class ProviderConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderConfig.class);

  @Bean
  public ProviderTransport providerTransport(
      HttpProperties httpProperties, ObjectMapper objectMapper) {
    return new JdkProviderTransport(httpProperties, objectMapper);
  }

  @Bean
  public RemotePoller remotePoller(VideoGenProperties properties, Clock clock) {
    PollingPolicy policy =
        new PollingPolicy(
            Duration.ofSeconds(properties.polling().intervalSeconds()),
            properties.polling().maxAttempts(),
            Duration.ofSeconds(properties.taskTimeLimitSeconds()));
    return new RemotePoller(policy, Sleeper.THREAD, clock);
  }

  @Bean
  public AliyunProviderAdapter aliyunProviderAdapter(
      AliyunProperties aliyunProperties,
      ProviderTransport transport,
      HttpProperties httpProperties,
      ArtifactResolver artifactResolver,
      RemotePoller remotePoller,
      Clock clock) {
    return new AliyunProviderAdapter(
        aliyunProperties, transport, httpProperties, artifactResolver, remotePoller, clock);
  }

  @Bean
  public ZhipuAiProviderAdapter zhipuAiProviderAdapter(
      ZhipuAiProperties zhipuAiProperties,
      ProviderTransport transport,
      HttpProperties httpProperties,
      ArtifactResolver artifactResolver,
      RemotePoller remotePoller,
      Clock clock) {
    return new ZhipuAiProviderAdapter(
        zhipuAiProperties, transport, httpProperties, artifactResolver, remotePoller, clock);
  }

  @Bean
  public ProviderRegistry providerRegistry(
      VideoGenProperties properties,
      AliyunProviderAdapter aliyunProviderAdapter,
      ZhipuAiProviderAdapter zhipuAiProviderAdapter) {
    ProviderRegistry registry =
        ProviderRegistry.builder()
            .register(aliyunProviderAdapter)
            .register(zhipuAiProviderAdapter)
            .defaultProvider(properties.defaultProvider())
            .build();
    LOGGER.info(
        "Registered providers: {} (default: {})",
        registry.listAll().keySet(),
        registry.defaultProviderName());
    return registry;
  }
}
