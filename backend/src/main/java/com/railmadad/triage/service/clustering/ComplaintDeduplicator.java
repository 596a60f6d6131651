package com.railmadad.triage.service.clustering;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.google.common.util.concurrent.Striped;
import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.cluster.Cluster;
import com.railmadad.triage.dto.cluster.ClusterKey;
import com.railmadad.triage.dto.cluster.DedupOutcome;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.exception.StorageUnavailableException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches complaints to active clusters or opens new ones.
 *
 * <p>Every read-modify-write on clusters of one {@link ClusterKey} happens under that key's lock,
 * so two near-identical complaints arriving together end up in one cluster. Key locks come from a
 * fixed stripe pool, so the number of distinct reporter locations does not grow lock memory. At
 * most one key lock is held at a time.
 * Complaints without a known location may join any cluster of their category, but only under the
 * stricter unknown-location threshold.
 *
 * <p>If the store cannot be reached, or a key lock is not acquired in time, the complaint is
 * treated as new and the outcome is marked degraded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplaintDeduplicator {

  static final int LOCK_STRIPES = 1024;

  private final ClusterStore clusterStore;
  private final TriageProperties properties;
  private final Clock clock;

  /** Fixed lock pool; a key always maps to the same stripe, unrelated keys may share one. */
  private final Striped<Lock> keyLocks = Striped.lock(LOCK_STRIPES);

  public DedupOutcome matchOrCreate(
      Category category, String locationToken, double[] vector, String complaintId, Instant at) {
    ClusterKey key = ClusterKey.of(category, locationToken);
    try {
      DedupOutcome outcome =
          key.isUnknownLocation()
              ? matchUnknownLocation(key, vector, complaintId, at)
              : withKeyLock(
                  key,
                  () ->
                      matchWithinKey(
                          key,
                          vector,
                          complaintId,
                          at,
                          properties.getClustering().getMatchThreshold()));
      log.debug(
          "Complaint {} {} cluster {} ({} members)",
          complaintId,
          outcome.isNewCluster() ? "opened" : "joined",
          outcome.clusterId(),
          outcome.memberCount());
      return outcome;
    } catch (StorageUnavailableException e) {
      log.warn("Deduplication unavailable for complaint {} at {}: {}", complaintId, key, e.getMessage());
      return DedupOutcome.unavailable();
    }
  }

  /**
   * Deactivates clusters idle longer than the inactivity window. Clusters whose key lock is busy
   * are skipped until the next sweep. Stops early when the calling thread is interrupted.
   *
   * @return number of clusters deactivated
   */
  public int sweepInactive() {
    Instant cutoff = clock.instant().minus(properties.getClustering().getInactivityWindow());
    int deactivated = 0;

    for (Cluster cluster : clusterStore.findAll()) {
      if (Thread.currentThread().isInterrupted()) {
        log.info("Cluster sweep interrupted after {} deactivations", deactivated);
        break;
      }
      if (!cluster.isActive() || !cluster.getLastSeen().isBefore(cutoff)) {
        continue;
      }
      try {
        Boolean changed =
            withKeyLock(
                cluster.key(),
                () ->
                    clusterStore
                        .findById(cluster.getId())
                        .filter(Cluster::isActive)
                        .filter(current -> current.getLastSeen().isBefore(cutoff))
                        .map(
                            current -> {
                              current.setActive(false);
                              clusterStore.save(current);
                              return true;
                            })
                        .orElse(false));
        if (changed) {
          deactivated++;
        }
      } catch (StorageUnavailableException e) {
        log.debug("Skipping cluster {} this sweep: {}", cluster.getId(), e.getMessage());
      }
    }
    return deactivated;
  }

  private DedupOutcome matchUnknownLocation(
      ClusterKey key, double[] vector, String complaintId, Instant at) {
    double threshold = properties.getClustering().getUnknownLocationThreshold();

    Optional<Cluster> nearest =
        nearest(clusterStore.findActiveByCategory(key.getCategory()), vector, threshold);
    if (nearest.isPresent() && !nearest.get().key().equals(key)) {
      String clusterId = nearest.get().getId();
      DedupOutcome outcome =
          withKeyLock(
              nearest.get().key(),
              () ->
                  clusterStore
                      .findById(clusterId)
                      .filter(this::isLive)
                      .filter(current -> isComparable(current, vector))
                      .filter(
                          current -> FeatureVectorizer.distance(current.getCentroid(), vector) < threshold)
                      .map(current -> DedupOutcome.matched(absorb(current, vector, at)))
                      .orElse(null));
      if (outcome != null) {
        return outcome;
      }
    }
    return withKeyLock(key, () -> matchWithinKey(key, vector, complaintId, at, threshold));
  }

  private DedupOutcome matchWithinKey(
      ClusterKey key, double[] vector, String complaintId, Instant at, double threshold) {
    return nearest(clusterStore.findActive(key), vector, threshold)
        .map(cluster -> DedupOutcome.matched(absorb(cluster, vector, at)))
        .orElseGet(() -> DedupOutcome.created(create(key, vector, complaintId, at)));
  }

  private Optional<Cluster> nearest(List<Cluster> candidates, double[] vector, double threshold) {
    Cluster best = null;
    double bestDistance = Double.MAX_VALUE;
    for (Cluster candidate : candidates) {
      if (!isLive(candidate) || !isComparable(candidate, vector)) {
        continue;
      }
      double distance = FeatureVectorizer.distance(candidate.getCentroid(), vector);
      if (distance < threshold && distance < bestDistance) {
        best = candidate;
        bestDistance = distance;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Active and not yet past the inactivity window, even if the sweep has not run. */
  private boolean isLive(Cluster cluster) {
    Duration window = properties.getClustering().getInactivityWindow();
    return cluster.isActive() && !cluster.getLastSeen().isBefore(clock.instant().minus(window));
  }

  private static boolean isComparable(Cluster cluster, double[] vector) {
    return cluster.getCentroid() != null && cluster.getCentroid().length == vector.length;
  }

  private Cluster absorb(Cluster cluster, double[] vector, Instant at) {
    double alpha = properties.getClustering().getCentroidAlpha();
    double[] centroid = cluster.getCentroid();
    for (int i = 0; i < centroid.length; i++) {
      centroid[i] = (1.0 - alpha) * centroid[i] + alpha * vector[i];
    }
    cluster.setCentroid(centroid);
    cluster.setMemberCount(cluster.getMemberCount() + 1);
    if (at != null && at.isAfter(cluster.getLastSeen())) {
      cluster.setLastSeen(at);
    }
    return clusterStore.save(cluster);
  }

  private Cluster create(ClusterKey key, double[] vector, String complaintId, Instant at) {
    Instant seen = at != null ? at : clock.instant();
    Cluster cluster =
        Cluster.builder()
            .id(UUID.randomUUID().toString())
            .category(key.getCategory())
            .locationToken(key.getLocationToken())
            .centroid(vector.clone())
            .memberCount(1)
            .firstSeen(seen)
            .lastSeen(seen)
            .representativeComplaintId(complaintId)
            .active(true)
            .build();
    return clusterStore.save(cluster);
  }

  int lockCount() {
    return keyLocks.size();
  }

  private <T> T withKeyLock(ClusterKey key, Supplier<T> action) {
    Lock lock = keyLocks.get(key);
    Duration timeout = properties.getClustering().getLockTimeout();
    boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageUnavailableException("Interrupted waiting for cluster key " + key, e);
    }
    if (!acquired) {
      throw new StorageUnavailableException(
          "Cluster key " + key + " busy for more than " + timeout.toMillis() + " ms");
    }
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
