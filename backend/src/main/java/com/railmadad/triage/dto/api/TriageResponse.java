package com.railmadad.triage.dto.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.railmadad.triage.dto.complaint.ComplaintDecision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageResponse {

  @JsonProperty("complaint_id")
  private String complaintId;

  @JsonProperty("acknowledgment")
  private String acknowledgment;

  @JsonProperty("decision")
  private ComplaintDecision decision;
}
