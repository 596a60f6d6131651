package com.railmadad.triage.dto.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.railmadad.triage.dto.chat.ChatEntities;
import com.railmadad.triage.dto.chat.ChatIntent;
import com.railmadad.triage.dto.complaint.ComplaintDecision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatComplaintResponse {

  @JsonProperty("intent")
  private ChatIntent intent;

  @JsonProperty("entities")
  private ChatEntities entities;

  @JsonProperty("complaint_registered")
  private boolean complaintRegistered;

  @JsonProperty("acknowledgment")
  private String acknowledgment;

  @JsonProperty("decision")
  private ComplaintDecision decision;
}
