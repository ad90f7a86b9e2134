package com.quantori.crp.core.thermo;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Standard formation data of one species.
 */
@Value
@Builder
public class FormationData {
  @NonNull
  String formula;
  /**
   * Standard enthalpy of formation, kJ/mol.
   */
  double enthalpy;
  /**
   * Standard Gibbs energy of formation, kJ/mol.
   */
  double gibbsEnergy;
  /**
   * Standard molar entropy, J/(mol K).
   */
  double entropy;
  /**
   * Molar heat capacity at constant pressure, J/(mol K).
   */
  double heatCapacity;
}
