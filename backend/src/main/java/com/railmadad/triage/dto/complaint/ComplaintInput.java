package com.railmadad.triage.dto.complaint;

import java.time.Instant;
import java.util.UUID;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A normalized complaint as handed to the engine by the intake collaborator. Immutable; media has
 * already been decoded to bytes.
 */
@Value
public class ComplaintInput {

  String complaintId;
  String text;

  @ToString.Exclude byte[] imageBytes;

  /** Opaque handle to an uploaded video; the engine only uses its presence. */
  String videoRef;

  Instant submittedAt;
  String reporterLocation;

  @Builder
  private ComplaintInput(
      String complaintId,
      String text,
      byte[] imageBytes,
      String videoRef,
      Instant submittedAt,
      String reporterLocation) {
    if (submittedAt == null) {
      throw new IllegalArgumentException("submittedAt is required");
    }
    this.complaintId =
        complaintId == null || complaintId.isBlank() ? UUID.randomUUID().toString() : complaintId;
    this.text = text == null ? "" : text;
    this.imageBytes = imageBytes == null ? null : imageBytes.clone();
    this.videoRef = videoRef;
    this.submittedAt = submittedAt;
    this.reporterLocation = reporterLocation;
  }

  public byte[] getImageBytes() {
    return imageBytes == null ? null : imageBytes.clone();
  }

  public boolean hasImage() {
    return imageBytes != null && imageBytes.length > 0;
  }

  public boolean hasVideo() {
    return videoRef != null && !videoRef.isBlank();
  }
}
