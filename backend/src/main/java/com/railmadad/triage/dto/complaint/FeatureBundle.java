package com.railmadad.triage.dto.complaint;

import java.time.Instant;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/** Features derived from one complaint; owned by the triage run that produced it. */
@Value
@Builder
public class FeatureBundle {

  public static final String UNKNOWN_LOCATION = "unknown";

  String normalizedText;

  /** Normalized OCR text; empty when there was no image or OCR failed. */
  @Builder.Default String ocrText = "";

  @Getter(AccessLevel.NONE)
  boolean hasMedia;

  @Builder.Default String locationToken = UNKNOWN_LOCATION;

  /** Set when media could not be used and the bundle fell back to text-only features. */
  boolean degraded;

  Instant submittedAt;

  /** Free text and OCR text joined, for models that consume a single string. */
  public String combinedText() {
    if (ocrText == null || ocrText.isEmpty()) {
      return normalizedText;
    }
    if (normalizedText == null || normalizedText.isEmpty()) {
      return ocrText;
    }
    return normalizedText + " " + ocrText;
  }

  public boolean hasMedia() {
    return hasMedia;
  }

  public boolean isEmpty() {
    String combined = combinedText();
    return combined == null || combined.isBlank();
  }
}
