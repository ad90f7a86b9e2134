package com.quantori.crp.core.classify;

import com.quantori.crp.core.fingerprint.ReactionFingerprint;
import com.quantori.crp.core.group.FunctionalGroupAnalysis;
import com.quantori.crp.core.oxidation.ElectronTransfer;
import com.quantori.crp.core.rule.RuleEvaluation;
import lombok.Builder;
import lombok.Value;

/**
 * Full analysis report of a reaction. Parts whose computation failed are null; the classification is
 * always present.
 */
@Value
@Builder
public class ReactionAnalysis {
  ClassificationResult classification;
  ElectronTransfer electronTransfer;
  FunctionalGroupAnalysis functionalGroups;
  RuleEvaluation ruleEvaluation;
  ReactionFingerprint fingerprint;

  public ReactionType getPrimaryType() {
    return classification.getPrimaryType();
  }
}
