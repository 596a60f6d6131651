package com.railmadad.triage.service.classification;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.FeatureBundle;

import lombok.RequiredArgsConstructor;

/**
 * Scores urgency in [0, 1] as a weighted sum of safety terms, urgency words, attached media and
 * recency, clamped. Every signal only adds, so adding a safety term never lowers the score.
 * Recency decays linearly to zero over the configured window.
 */
@Component
@RequiredArgsConstructor
public class UrgencyScorer {

  private final TriageProperties properties;
  private final Clock clock;

  public double score(FeatureBundle bundle) {
    TriageProperties.Urgency weights = properties.getUrgency();
    String padded = ComplaintVocabulary.pad(bundle.combinedText());

    double score = 0.0;
    if (ComplaintVocabulary.containsAny(padded, ComplaintVocabulary.SAFETY_TERMS)) {
      score += weights.getSafetyWeight();
    }
    if (ComplaintVocabulary.containsAny(padded, ComplaintVocabulary.URGENT_TERMS)) {
      score += weights.getUrgentWordWeight();
    }
    if (bundle.hasMedia()) {
      score += weights.getMediaWeight();
    }
    score += weights.getRecencyWeight() * recency(bundle.getSubmittedAt(), weights);
    return clamp(score);
  }

  private double recency(Instant submittedAt, TriageProperties.Urgency weights) {
    if (submittedAt == null) {
      return 0.0;
    }
    Duration age = Duration.between(submittedAt, clock.instant());
    if (age.isNegative() || age.isZero()) {
      return 1.0;
    }
    long windowMillis = weights.getRecencyWindow().toMillis();
    if (windowMillis <= 0) {
      return 0.0;
    }
    return Math.max(0.0, 1.0 - (double) age.toMillis() / windowMillis);
  }

  static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
