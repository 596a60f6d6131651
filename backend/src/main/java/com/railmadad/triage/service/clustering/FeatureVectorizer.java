package com.railmadad.triage.service.clustering;

import java.nio.charset.StandardCharsets;

import org.springframework.stereotype.Component;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.FeatureBundle;
import com.railmadad.triage.service.classification.ComplaintVocabulary;
import com.railmadad.triage.service.extraction.TextNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Hashed bag-of-words vectors for complaint similarity. Tokens are bucketed with murmur3 into a
 * fixed dimension and the vector is L2-normalized, so identical text always yields an identical
 * vector and distance 0.
 */
@Component
@RequiredArgsConstructor
public class FeatureVectorizer {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();

  private final TextNormalizer textNormalizer;
  private final TriageProperties properties;

  public double[] vectorize(FeatureBundle bundle) {
    double[] vector = new double[properties.getClustering().getVectorDimension()];

    for (String token : textNormalizer.tokens(bundle.combinedText())) {
      if (token.length() < 2 || ComplaintVocabulary.STOP_WORDS.contains(token)) {
        continue;
      }
      int bucket = Math.floorMod(HASH.hashString(token, StandardCharsets.UTF_8).asInt(), vector.length);
      vector[bucket] += 1.0;
    }

    double norm = 0.0;
    for (double value : vector) {
      norm += value * value;
    }
    if (norm > 0.0) {
      norm = Math.sqrt(norm);
      for (int i = 0; i < vector.length; i++) {
        vector[i] /= norm;
      }
    }
    return vector;
  }

  public static double cosineSimilarity(double[] vector1, double[] vector2) {
    if (vector1.length != vector2.length) {
      throw new IllegalArgumentException("Vectors must have the same dimension");
    }

    double dotProduct = 0.0;
    double norm1 = 0.0;
    double norm2 = 0.0;

    for (int i = 0; i < vector1.length; i++) {
      dotProduct += vector1[i] * vector2[i];
      norm1 += Math.pow(vector1[i], 2);
      norm2 += Math.pow(vector2[i], 2);
    }

    if (norm1 == 0.0 || norm2 == 0.0) {
      return 0.0;
    }
    return dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
  }

  /** Cosine distance in [0, 2]; a zero vector is at distance 1 from everything. */
  public static double distance(double[] vector1, double[] vector2) {
    return 1.0 - cosineSimilarity(vector1, vector2);
  }
}
