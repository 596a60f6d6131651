package com.railmadad.triage.service.clustering;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.railmadad.triage.dto.cluster.Cluster;
import com.railmadad.triage.dto.cluster.ClusterKey;
import com.railmadad.triage.dto.complaint.Category;

import lombok.extern.slf4j.Slf4j;

/** Process-local cluster store. State is lost on restart. */
@Slf4j
@Repository
public class InMemoryClusterStore implements ClusterStore {

  private final Map<String, Cluster> clusters = new ConcurrentHashMap<>();

  @Override
  public List<Cluster> findActive(ClusterKey key) {
    return clusters.values().stream()
        .filter(Cluster::isActive)
        .filter(cluster -> cluster.key().equals(key))
        .map(Cluster::snapshot)
        .collect(Collectors.toList());
  }

  @Override
  public List<Cluster> findActiveByCategory(Category category) {
    return clusters.values().stream()
        .filter(Cluster::isActive)
        .filter(cluster -> cluster.getCategory() == category)
        .map(Cluster::snapshot)
        .collect(Collectors.toList());
  }

  @Override
  public Optional<Cluster> findById(String clusterId) {
    return Optional.ofNullable(clusters.get(clusterId)).map(Cluster::snapshot);
  }

  @Override
  public List<Cluster> findAll() {
    return clusters.values().stream().map(Cluster::snapshot).collect(Collectors.toList());
  }

  @Override
  public Cluster save(Cluster cluster) {
    clusters.put(cluster.getId(), cluster.snapshot());
    log.trace("Saved cluster {} ({} members)", cluster.getId(), cluster.getMemberCount());
    return cluster.snapshot();
  }
}
