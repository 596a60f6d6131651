package com.railmadad.triage.dto.complaint;

import lombok.Builder;
import lombok.Value;

/**
 * Category assignment plus an urgency score. Confidence comes from the category model, urgency
 * from the urgency scorer; neither is derived from the other.
 */
@Value
@Builder(toBuilder = true)
public class ClassificationResult {

  Category category;
  double confidence;
  double urgency;
  String modelId;
  boolean fallback;
}
