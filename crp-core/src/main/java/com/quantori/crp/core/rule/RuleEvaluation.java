package com.quantori.crp.core.rule;

import com.quantori.crp.core.classify.ReactionType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Result of running every expert rule against one reaction. Rules that threw are kept as failures so
 * callers can tell "did not match" from "could not be evaluated".
 */
@Value
public class RuleEvaluation {
  List<RuleMatch> matches;
  List<RuleFailure> failures;

  public static RuleEvaluation empty() {
    return new RuleEvaluation(List.of(), List.of());
  }

  public boolean hasMatches() {
    return !matches.isEmpty();
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /**
   * Highest confidence among the matching rules of each type.
   *
   * @return type to confidence, only matched types
   */
  public Map<ReactionType, Double> maxConfidenceByType() {
    Map<ReactionType, Double> confidences = new EnumMap<>(ReactionType.class);
    matches.forEach(match -> confidences.merge(match.getType(), match.getConfidence(), Math::max));
    return confidences;
  }
}
