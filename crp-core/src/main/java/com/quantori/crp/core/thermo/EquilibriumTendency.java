package com.quantori.crp.core.thermo;

import lombok.Getter;

/**
 * Which side an equilibrium lies on, read from the equilibrium constant.
 */
@Getter
public enum EquilibriumTendency {
  STRONGLY_FAVORS_PRODUCTS("reaction strongly favors products"),
  FAVORS_PRODUCTS("reaction favors products"),
  AT_EQUILIBRIUM("reaction is at equilibrium"),
  FAVORS_REACTANTS("reaction favors reactants"),
  STRONGLY_FAVORS_REACTANTS("reaction strongly favors reactants"),
  UNDETERMINED("cannot determine without complete thermodynamic data");

  private static final double STRONG_LIMIT = 1000.0;

  private final String description;

  EquilibriumTendency(String description) {
    this.description = description;
  }

  /**
   * Tendency for an equilibrium constant.
   *
   * @param constant equilibrium constant, null when unknown
   * @return tendency, {@link #UNDETERMINED} for null
   */
  public static EquilibriumTendency of(Double constant) {
    if (constant == null || constant.isNaN()) {
      return UNDETERMINED;
    }
    if (constant > STRONG_LIMIT) {
      return STRONGLY_FAVORS_PRODUCTS;
    }
    if (constant > 1.0) {
      return FAVORS_PRODUCTS;
    }
    if (constant == 1.0) {
      return AT_EQUILIBRIUM;
    }
    if (constant > 1.0 / STRONG_LIMIT) {
      return FAVORS_REACTANTS;
    }
    return STRONGLY_FAVORS_REACTANTS;
  }
}
