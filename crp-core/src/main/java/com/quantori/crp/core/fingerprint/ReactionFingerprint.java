package com.quantori.crp.core.fingerprint;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Comparable snapshot of a reaction used for diagnostics and tests. It makes no classification
 * decisions.
 */
@Value
@Builder
public class ReactionFingerprint {
  /**
   * Coefficient-weighted atom totals of the reactants, catalysts excluded.
   */
  Map<String, Double> reactantElements;
  Map<String, Double> productElements;
  /**
   * Products minus reactants for every element of either side.
   */
  Map<String, Double> elementBalance;
  /**
   * Hill formulas present on both sides with a different known phase.
   */
  Map<String, PhaseChange> phaseChanges;
  boolean chargeTransfer;
  int reactantCount;
  int productCount;

  public boolean hasPhaseChanges() {
    return !phaseChanges.isEmpty();
  }
}
