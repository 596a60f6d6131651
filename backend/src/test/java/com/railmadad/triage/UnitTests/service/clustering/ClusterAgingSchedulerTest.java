package com.railmadad.triage.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.fixtures.TriageTestFixtures;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClusterAgingScheduler Tests")
class ClusterAgingSchedulerTest {

  @Mock private ComplaintDeduplicator deduplicator;

  private TriageProperties properties;
  private ThreadPoolTaskExecutor executor;
  private ClusterAgingScheduler scheduler;

  @BeforeEach
  void setUp() {
    properties = new TriageProperties();
    executor = TriageTestFixtures.executor("sweep-test-");
    scheduler = new ClusterAgingScheduler(deduplicator, properties, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void shouldReturnNumberOfDeactivatedClusters() {
    when(deduplicator.sweepInactive()).thenReturn(3);

    assertThat(scheduler.runSweep()).isEqualTo(3);
  }

  @Test
  void shouldDeferSweepThatExceedsTimeout() {
    // Given
    properties.getClustering().setSweepTimeout(Duration.ofMillis(50));
    when(deduplicator.sweepInactive())
        .thenAnswer(
            invocation -> {
              Thread.sleep(2_000);
              return 1;
            });

    // When
    long start = System.nanoTime();
    int result = scheduler.runSweep();

    // Then
    assertThat(result).isEqualTo(-1);
    assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(1_000);
  }

  @Test
  void shouldSwallowSweepFailureUntilNextRun() {
    when(deduplicator.sweepInactive()).thenThrow(new IllegalStateException("boom"));

    assertThat(scheduler.runSweep()).isEqualTo(-1);
  }
}
