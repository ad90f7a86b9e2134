package com.quantori.crp.api;

import java.util.Map;

/**
 * Read-only view of a molecule as consumed by reaction balancing and classification: element
 * composition, charge, phase, weight and formula. Nothing about the molecule's internal
 * representation is required.
 */
public interface MoleculeComposition {

  /**
   * Element composition in Hill order.
   *
   * @return ordered, unmodifiable mapping of element symbol to a positive atom count
   */
  Map<String, Integer> getElements();

  /**
   * Canonical Hill formula of {@link #getElements()}, without charge.
   *
   * @return Hill formula
   */
  String getFormula();

  double getMolecularWeight();

  /**
   * Phase of the molecule itself; {@link Phase#NONE} when unknown.
   *
   * @return phase, never null
   */
  Phase getPhase();

  /**
   * Net ionic charge, {@code 0} for neutral species.
   *
   * @return signed charge
   */
  int getCharge();

  /**
   * Formula as it was written (e.g. {@code CH3COOH} for the Hill formula {@code C2H4O2}), without
   * charge. Text pattern heuristics work on this rendering.
   *
   * @return written formula, the Hill formula when nothing else is known
   */
  default String getNotation() {
    return getFormula();
  }

  /**
   * Whether the species consists of a single element, e.g. {@code O2} or {@code Fe³⁺}.
   *
   * @return true for elemental substances and monatomic ions
   */
  default boolean isSingleElement() {
    return getElements().size() == 1;
  }

  default boolean containsElement(String symbol) {
    return getElements().containsKey(symbol);
  }
}
