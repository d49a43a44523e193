package com.scholary.videogen.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background task execution.
 *
 * <p>Sets up a bounded thread pool for async video tasks. When the queue is full new submissions
 * are rejected and the task is marked failed.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(VideoGenProperties properties) {
    VideoGenProperties.WorkerProperties worker = properties.worker();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(worker.threads());
    executor.setMaxPoolSize(worker.threads());
    executor.setQueueCapacity(worker.queueCapacity());
    executor.setThreadNamePrefix("videogen-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
