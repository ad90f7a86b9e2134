package com.quantori.crp.core.classify;

import java.util.Map;
import lombok.Value;

/**
 * Confidence per reaction type, each in [0, 1], and the winning type.
 */
@Value
public class ClassificationResult {
  Map<ReactionType, Double> confidenceScores;
  ReactionType primaryType;

  public double confidence(ReactionType type) {
    return confidenceScores.getOrDefault(type, 0.0);
  }

  public double getPrimaryConfidence() {
    return confidence(primaryType);
  }
}
