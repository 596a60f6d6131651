package com.railmadad.triage.dto.cluster;

import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.FeatureBundle;

import lombok.NonNull;
import lombok.Value;

/** Identity of a cluster bucket; all read-modify-write on clusters is serialized per key. */
@Value
public class ClusterKey {

  @NonNull Category category;
  @NonNull String locationToken;

  public static ClusterKey of(Category category, String locationToken) {
    return new ClusterKey(category, locationToken);
  }

  public boolean isUnknownLocation() {
    return FeatureBundle.UNKNOWN_LOCATION.equals(locationToken);
  }

  @Override
  public String toString() {
    return category + "@" + locationToken;
  }
}
