package com.railmadad.triage.service.classification;

import java.util.Map;

import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.ClassificationResult;
import com.railmadad.triage.dto.complaint.FeatureBundle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a category and urgency to a feature bundle. Category comes from the configured
 * {@link ComplaintModel}; a top probability under the confidence threshold yields
 * {@link Category#OTHER} with the probability kept as confidence. Deterministic for a fixed model
 * and clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplaintClassifier {

  public static final String FALLBACK_MODEL_ID = "fallback";

  private final ComplaintModel complaintModel;
  private final UrgencyScorer urgencyScorer;
  private final TriageProperties properties;

  public ClassificationResult classify(FeatureBundle bundle) {
    TriageProperties.Classification config = properties.getClassification();

    if (bundle.isEmpty()) {
      log.debug("Empty complaint, classifying as OTHER without consulting the model");
      return ClassificationResult.builder()
          .category(Category.OTHER)
          .confidence(0.0)
          .urgency(UrgencyScorer.clamp(config.getDefaultUrgency()))
          .modelId(complaintModel.getModelId())
          .build();
    }

    Map<Category, Double> distribution = complaintModel.predict(bundle.combinedText());

    Category top = Category.OTHER;
    double topProbability = 0.0;
    // enum order breaks ties
    for (Category category : Category.values()) {
      double probability = distribution.getOrDefault(category, 0.0);
      if (probability > topProbability) {
        top = category;
        topProbability = probability;
      }
    }

    double confidence = UrgencyScorer.clamp(topProbability);
    Category category = confidence < config.getConfidenceThreshold() ? Category.OTHER : top;

    return ClassificationResult.builder()
        .category(category)
        .confidence(confidence)
        .urgency(urgencyScorer.score(bundle))
        .modelId(complaintModel.getModelId())
        .build();
  }

  /** Result used when the model is unavailable or too slow. */
  public ClassificationResult fallback() {
    return ClassificationResult.builder()
        .category(Category.OTHER)
        .confidence(0.0)
        .urgency(UrgencyScorer.clamp(properties.getClassification().getFallbackUrgency()))
        .modelId(FALLBACK_MODEL_ID)
        .fallback(true)
        .build();
  }
}
