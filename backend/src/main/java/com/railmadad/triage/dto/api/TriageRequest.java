package com.railmadad.triage.dto.api;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A passenger complaint to triage")
public class TriageRequest {

  @JsonProperty("complaint_id")
  @Schema(description = "Caller-assigned id; generated when absent")
  private String complaintId;

  @Size(max = 5000)
  @JsonProperty("text")
  @Schema(example = "Seat broken, smells bad")
  private String text;

  @ToString.Exclude
  @JsonProperty("image")
  @Schema(description = "Base64-encoded JPEG or PNG", type = "string", format = "byte")
  private byte[] image;

  @JsonProperty("video_ref")
  private String videoRef;

  @Size(max = 100)
  @JsonProperty("location")
  @Schema(example = "Coach-B12")
  private String location;

  @JsonProperty("submitted_at")
  @Schema(description = "Defaults to the time the request is received")
  private Instant submittedAt;
}
