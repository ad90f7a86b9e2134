package com.quantori.crp.core.thermo;

import java.util.List;
import java.util.OptionalDouble;
import lombok.Value;

/**
 * Reaction Gibbs energy in kJ/mol with the equilibrium constant derived from it.
 */
@Value
public class GibbsEnergyChange {
  double value;
  double temperature;
  /**
   * {@code exp(-ΔG / RT)}, null when formation data is missing.
   */
  Double equilibriumConstant;
  List<String> missingSpecies;

  public boolean isComplete() {
    return missingSpecies.isEmpty();
  }

  public boolean isSpontaneous() {
    return value < 0;
  }

  public OptionalDouble findEquilibriumConstant() {
    return equilibriumConstant == null ? OptionalDouble.empty() : OptionalDouble.of(equilibriumConstant);
  }

  public EquilibriumTendency getTendency() {
    return EquilibriumTendency.of(equilibriumConstant);
  }
}
