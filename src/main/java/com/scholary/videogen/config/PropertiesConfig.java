package com.scholary.videogen.config;

import com.scholary.videogen.provider.aliyun.AliyunProperties;
import com.scholary.videogen.provider.http.HttpProperties;
import com.scholary.videogen.provider.zhipuai.ZhipuAiProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the service's configuration properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  VideoGenProperties.class,
  HttpProperties.class,
  AliyunProperties.class,
  ZhipuAiProperties.class
})
public class PropertiesConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
