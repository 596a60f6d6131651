package com.railmadad.triage.service.classification;

import org.springframework.stereotype.Component;

import com.railmadad.triage.dto.complaint.Sentiment;

/** Word-count sentiment over normalized text. Informational only; never affects routing. */
@Component
public class SentimentAnalyzer {

  public Sentiment analyze(String normalizedText) {
    String padded = ComplaintVocabulary.pad(normalizedText);
    long negative = ComplaintVocabulary.countMatches(padded, ComplaintVocabulary.NEGATIVE_TERMS);
    // "not working" must not also count as "working"
    String withoutNegations = padded.replace(" not working ", " ");
    long positive =
        ComplaintVocabulary.countMatches(withoutNegations, ComplaintVocabulary.POSITIVE_TERMS);

    if (negative > positive) {
      return Sentiment.NEGATIVE;
    }
    if (positive > negative) {
      return Sentiment.POSITIVE;
    }
    return Sentiment.NEUTRAL;
  }
}
