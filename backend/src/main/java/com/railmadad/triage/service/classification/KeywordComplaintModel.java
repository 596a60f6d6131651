package com.railmadad.triage.service.classification;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.railmadad.triage.dto.complaint.Category;

import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic keyword model. Each category scores its matched terms, safety terms counting
 * double, and the scores are normalized into a distribution. Text with no matches is
 * {@link Category#OTHER} with probability 1.
 */
@Slf4j
@Service
@ConditionalOnProperty(
    name = "triage.classification.model",
    havingValue = "keyword",
    matchIfMissing = true)
public class KeywordComplaintModel implements ComplaintModel {

  static final String MODEL_ID = "keyword-v1";
  private static final double SAFETY_WEIGHT = 2.0;

  @Override
  public Map<Category, Double> predict(String text) {
    String padded = ComplaintVocabulary.pad(text);
    Map<Category, Double> scores = new EnumMap<>(Category.class);
    double total = 0.0;

    for (Map.Entry<Category, Set<String>> entry :
        ComplaintVocabulary.categoryTerms().entrySet()) {
      long hits = ComplaintVocabulary.countMatches(padded, entry.getValue());
      if (hits > 0) {
        double score = hits * (entry.getKey() == Category.SAFETY ? SAFETY_WEIGHT : 1.0);
        scores.put(entry.getKey(), score);
        total += score;
      }
    }

    Map<Category, Double> distribution = new EnumMap<>(Category.class);
    if (total == 0.0) {
      distribution.put(Category.OTHER, 1.0);
      return distribution;
    }
    for (Map.Entry<Category, Double> score : scores.entrySet()) {
      distribution.put(score.getKey(), score.getValue() / total);
    }
    log.debug("Keyword distribution: {}", distribution);
    return distribution;
  }

  @Override
  public String getModelId() {
    return MODEL_ID;
  }
}
