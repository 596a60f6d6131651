package com.railmadad.triage.service.clustering;

import java.util.List;
import java.util.Optional;

import com.railmadad.triage.dto.cluster.Cluster;
import com.railmadad.triage.dto.cluster.ClusterKey;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.exception.StorageUnavailableException;

/**
 * Persistent cluster state. Reads return copies; changes become visible only through
 * {@link #save(Cluster)}. Callers serialize writes per {@link ClusterKey}. Every method may throw
 * {@link StorageUnavailableException}.
 */
public interface ClusterStore {

  List<Cluster> findActive(ClusterKey key);

  List<Cluster> findActiveByCategory(Category category);

  Optional<Cluster> findById(String clusterId);

  List<Cluster> findAll();

  /** Inserts or replaces the cluster with the same id. */
  Cluster save(Cluster cluster);
}
