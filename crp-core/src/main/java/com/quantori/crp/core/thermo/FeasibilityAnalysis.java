package com.quantori.crp.core.thermo;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Thermodynamic feasibility of a reaction at one temperature.
 */
@Value
@Builder
public class FeasibilityAnalysis {
  double temperature;
  /**
   * False when any species lacks formation data; the other values then cover tabulated species only.
   */
  boolean complete;
  boolean feasible;
  EnthalpyChange enthalpy;
  EntropyChange entropy;
  GibbsEnergyChange gibbsEnergy;
  TemperatureRegime regime;
  /**
   * Temperature in K where ΔG changes sign, null unless the regime has a crossover.
   */
  Double crossoverTemperature;
  @Singular
  List<String> recommendations;
}
