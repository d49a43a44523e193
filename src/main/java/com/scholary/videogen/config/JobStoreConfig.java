package com.scholary.videogen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videogen.job.InMemoryJobStore;
import com.scholary.videogen.job.JobStore;
import com.scholary.videogen.job.MongoJobStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Selects the job store backend from {@code jobstore.type}.
 *
 * <p>{@code memory} (the default) keeps jobs in process; {@code mongo} persists them in the
 * {@code tasks} collection.
 */
@Configuration
public class JobStoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStoreConfig.class);

  @Bean
  @ConditionalOnProperty(name = "jobstore.type", havingValue = "memory", matchIfMissing = true)
  public JobStore inMemoryJobStore(Clock clock) {
    LOGGER.info("Using in-memory job store");
    return new InMemoryJobStore(clock);
  }

  @Bean
  @ConditionalOnProperty(name = "jobstore.type", havingValue = "mongo")
  public JobStore mongoJobStore(
      MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
    MongoJobStore store = new MongoJobStore(mongoTemplate, objectMapper, clock);
    store.ensureIndexes();
    LOGGER.info("Using MongoDB job store");
    return store;
  }
}
