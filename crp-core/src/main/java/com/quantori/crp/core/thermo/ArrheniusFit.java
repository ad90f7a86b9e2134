package com.quantori.crp.core.thermo;

import lombok.Builder;
import lombok.Value;

/**
 * Least squares fit of {@code ln k = ln A - Ea / RT}.
 */
@Value
@Builder
public class ArrheniusFit {
  /**
   * Activation energy, kJ/mol.
   */
  double activationEnergy;
  double preExponentialFactor;
  double rSquared;
  double minTemperature;
  double maxTemperature;
  int dataPoints;
}
