package com.railmadad.triage.dto.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatComplaintRequest {

  @NotBlank
  @Size(max = 2000)
  @JsonProperty("message")
  private String message;

  @JsonProperty("session_id")
  private String sessionId;
}
