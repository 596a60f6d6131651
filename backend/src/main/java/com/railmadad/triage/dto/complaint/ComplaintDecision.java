package com.railmadad.triage.dto.complaint;

import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Output of one triage run. Besides the routing decision it carries the provenance analytics needs
 * to aggregate trends without recomputing anything.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplaintDecision {

  @JsonProperty("complaint_id")
  String complaintId;

  @JsonProperty("category")
  Category category;

  /** Urgency used for the deadline, after any recurrence escalation. */
  @JsonProperty("urgency")
  double urgency;

  @JsonProperty("urgency_tier")
  String urgencyTier;

  @JsonProperty("department")
  Department department;

  @JsonProperty("sla_deadline")
  Instant slaDeadline;

  /** Id of the matched cluster; null when the complaint seeded a new one or dedup degraded. */
  @JsonProperty("duplicate_of")
  String duplicateOf;

  /** Id of the cluster this complaint now belongs to, new or matched. */
  @JsonProperty("cluster_id")
  String clusterId;

  @JsonProperty("is_new_cluster")
  boolean newCluster;

  @JsonProperty("cluster_member_count")
  int clusterMemberCount;

  @JsonProperty("confidence")
  double confidence;

  @JsonProperty("raw_urgency")
  double rawUrgency;

  @JsonProperty("urgency_escalated")
  boolean urgencyEscalated;

  @JsonProperty("sentiment")
  Sentiment sentiment;

  @JsonProperty("model_id")
  String modelId;

  @Singular
  @JsonProperty("degradations")
  Set<Degradation> degradations;

  @JsonProperty("submitted_at")
  Instant submittedAt;

  @JsonProperty("decided_at")
  Instant decidedAt;

  @JsonProperty("processing_time_ms")
  long processingTimeMs;

  public boolean isDegraded() {
    return !degradations.isEmpty();
  }
}
