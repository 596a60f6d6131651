package com.railmadad.triage.dto.cluster;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Result of matching a complaint against the cluster store. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DedupOutcome {

  /** Snapshot of the matched or created cluster; null when dedup was unavailable. */
  Cluster cluster;

  boolean newCluster;

  /** True when the store could not be consulted and the complaint was treated as new. */
  boolean degraded;

  public static DedupOutcome matched(Cluster cluster) {
    return new DedupOutcome(cluster, false, false);
  }

  public static DedupOutcome created(Cluster cluster) {
    return new DedupOutcome(cluster, true, false);
  }

  public static DedupOutcome unavailable() {
    return new DedupOutcome(null, true, true);
  }

  public int memberCount() {
    return cluster == null ? 1 : cluster.getMemberCount();
  }

  public String clusterId() {
    return cluster == null ? null : cluster.getId();
  }
}
