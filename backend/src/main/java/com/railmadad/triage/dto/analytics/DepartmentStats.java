package com.railmadad.triage.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.railmadad.triage.dto.complaint.Department;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Workload and severity summary for one department")
public class DepartmentStats {

  @JsonProperty("department")
  private Department department;

  @JsonProperty("total")
  private long total;

  @JsonProperty("high_urgency_percentage")
  private double highUrgencyPercentage;

  @JsonProperty("negative_sentiment_percentage")
  private double negativeSentimentPercentage;
}
