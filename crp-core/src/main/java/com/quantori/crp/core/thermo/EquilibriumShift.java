package com.quantori.crp.core.thermo;

/**
 * Direction an equilibrium moves when a condition is raised.
 */
public enum EquilibriumShift {
  TOWARD_PRODUCTS,
  TOWARD_REACTANTS,
  NONE,
  UNDETERMINED
}
