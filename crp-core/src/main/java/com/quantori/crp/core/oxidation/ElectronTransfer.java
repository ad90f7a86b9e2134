package com.quantori.crp.core.oxidation;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of electron transfer detection for one reaction.
 */
@Value
@Builder
public class ElectronTransfer {

  /**
   * Evidence a result was derived from.
   */
  public enum Source {
    /** Averaged oxidation numbers estimated per molecule. */
    OXIDATION_STATES,
    /** Explicit charges of monatomic ions. */
    IONIC_CHARGES
  }

  boolean redox;
  Source source;
  /**
   * Signed change per element whose state moved, product minus reactant.
   */
  @Singular
  Map<String, Double> changes;
  /**
   * Label of the first reactant holding a reduced element, null when none.
   */
  String oxidizingAgent;
  /**
   * Label of the first reactant holding an oxidized element, null when none.
   */
  String reducingAgent;
  /**
   * Per-side oxidation numbers; null for results from ionic charges.
   */
  OxidationStateAssignment assignment;

  public Set<String> getOxidizedElements() {
    Set<String> oxidized = new TreeSet<>();
    changes.forEach((symbol, delta) -> {
      if (delta > 0) {
        oxidized.add(symbol);
      }
    });
    return oxidized;
  }

  public Set<String> getReducedElements() {
    Set<String> reduced = new TreeSet<>();
    changes.forEach((symbol, delta) -> {
      if (delta < 0) {
        reduced.add(symbol);
      }
    });
    return reduced;
  }
}
