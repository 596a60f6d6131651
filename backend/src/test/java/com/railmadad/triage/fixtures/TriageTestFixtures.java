package com.railmadad.triage.fixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.railmadad.triage.dto.complaint.ComplaintInput;
import com.railmadad.triage.dto.complaint.FeatureBundle;

/** Shared instants, clocks and builders for triage tests. */
public final class TriageTestFixtures {

  public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private TriageTestFixtures() {}

  public static Clock fixedClock() {
    return Clock.fixed(NOW, ZoneOffset.UTC);
  }

  public static ThreadPoolTaskExecutor executor(String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }

  public static ComplaintInput complaint(String text, String location) {
    return ComplaintInput.builder().text(text).reporterLocation(location).submittedAt(NOW).build();
  }

  public static FeatureBundle bundle(String normalizedText) {
    return FeatureBundle.builder().normalizedText(normalizedText).submittedAt(NOW).build();
  }
}
