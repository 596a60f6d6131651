package com.railmadad.triage.dto.cluster;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.railmadad.triage.dto.complaint.Category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A group of complaints judged to describe the same issue at the same category and location.
 *
 * <p>Instances held by a cluster store are mutated only while the key lock for {@link #key()} is
 * held. Anything handed out to readers is a {@link #snapshot()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {

  @JsonProperty("id")
  private String id;

  @JsonProperty("category")
  private Category category;

  @JsonProperty("location_token")
  private String locationToken;

  @JsonIgnore private double[] centroid;

  @JsonProperty("member_count")
  private int memberCount;

  @JsonProperty("first_seen")
  private Instant firstSeen;

  @JsonProperty("last_seen")
  private Instant lastSeen;

  @JsonProperty("representative_complaint_id")
  private String representativeComplaintId;

  @JsonProperty("active")
  private boolean active;

  public ClusterKey key() {
    return ClusterKey.of(category, locationToken);
  }

  public Cluster snapshot() {
    return toBuilder().centroid(centroid == null ? null : centroid.clone()).build();
  }
}
