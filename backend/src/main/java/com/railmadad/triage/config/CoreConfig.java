package com.railmadad.triage.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Runs whole triage tasks submitted through the orchestrator's async entry point. */
  @Bean
  public ThreadPoolTaskExecutor triageExecutor() {
    return executor(8, 32, 1000, "triage-");
  }

  /** Model inference; isolated so a slow model cannot starve intake. */
  @Bean
  public ThreadPoolTaskExecutor classifierExecutor() {
    return executor(8, 16, 200, "classifier-");
  }

  @Bean
  public ThreadPoolTaskExecutor ocrExecutor() {
    return executor(4, 8, 100, "ocr-");
  }

  /** Background cluster maintenance (aging sweep). */
  @Bean
  public ThreadPoolTaskExecutor clusterMaintenanceExecutor() {
    return executor(1, 1, 1, "cluster-sweep-");
  }

  @Bean
  public RestTemplate restTemplate() {
    return new RestTemplate();
  }

  private static ThreadPoolTaskExecutor executor(
      int corePoolSize, int maxPoolSize, int queueCapacity, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
