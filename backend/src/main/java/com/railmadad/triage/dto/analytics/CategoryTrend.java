package com.railmadad.triage.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.railmadad.triage.dto.complaint.Category;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Complaint volume for one category")
public class CategoryTrend {

  @JsonProperty("category")
  private Category category;

  @JsonProperty("count")
  private long count;

  @JsonProperty("percentage")
  @Schema(description = "Share of all recorded decisions, 0 to 100", example = "42.5")
  private double percentage;
}
