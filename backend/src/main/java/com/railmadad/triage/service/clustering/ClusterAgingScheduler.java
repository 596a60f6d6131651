package com.railmadad.triage.service.clustering;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.railmadad.triage.config.TriageProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodically ages out idle clusters. The sweep runs on the maintenance executor under a timeout;
 * a sweep that overruns is interrupted and the remaining clusters wait for the next run.
 */
@Slf4j
@Component
public class ClusterAgingScheduler {

  private final ComplaintDeduplicator deduplicator;
  private final TriageProperties properties;
  private final AsyncTaskExecutor maintenanceExecutor;

  public ClusterAgingScheduler(
      ComplaintDeduplicator deduplicator,
      TriageProperties properties,
      @Qualifier("clusterMaintenanceExecutor") AsyncTaskExecutor maintenanceExecutor) {
    this.deduplicator = deduplicator;
    this.properties = properties;
    this.maintenanceExecutor = maintenanceExecutor;
  }

  @Scheduled(
      fixedDelayString = "${triage.clustering.sweep-interval:PT5M}",
      initialDelayString = "${triage.clustering.sweep-interval:PT5M}")
  public void sweep() {
    runSweep();
  }

  /**
   * @return clusters deactivated, or -1 when the sweep was deferred
   */
  public int runSweep() {
    Duration timeout = properties.getClustering().getSweepTimeout();
    Future<Integer> future;
    try {
      future = maintenanceExecutor.submit(deduplicator::sweepInactive);
    } catch (RejectedExecutionException e) {
      log.warn("Cluster sweep deferred, previous sweep still running");
      return -1;
    }

    try {
      int deactivated = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (deactivated > 0) {
        log.info("Cluster sweep deactivated {} idle clusters", deactivated);
      }
      return deactivated;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Cluster sweep exceeded {} ms, deferring remainder", timeout.toMillis());
      return -1;
    } catch (ExecutionException e) {
      log.error("Cluster sweep failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
      return -1;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return -1;
    }
  }
}
