package com.railmadad.triage.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Decisions falling into one urgency tier")
public class UrgencyBucket {

  @JsonProperty("tier")
  @Schema(example = "HIGH")
  private String tier;

  @JsonProperty("count")
  private long count;

  @JsonProperty("percentage")
  private double percentage;
}
