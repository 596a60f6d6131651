package com.railmadad.triage.dto.complaint;

/** Non-fatal conditions a triage run absorbed while still producing a decision. */
public enum Degradation {
  /** OCR failed or timed out; text-only features were used. */
  OCR_FAILED,
  /** Classifier timed out or was unavailable; the default category and urgency were used. */
  CLASSIFIER_FALLBACK,
  /** Cluster store was unreachable or contended; the complaint was treated as a new issue. */
  DEDUP_UNAVAILABLE
}
