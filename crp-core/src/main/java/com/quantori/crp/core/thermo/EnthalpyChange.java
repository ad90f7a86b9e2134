package com.quantori.crp.core.thermo;

import java.util.List;
import lombok.Value;

/**
 * Reaction enthalpy in kJ/mol. When species are missing from the table the value only covers the
 * tabulated ones.
 */
@Value
public class EnthalpyChange {
  double value;
  double temperature;
  List<String> missingSpecies;

  public boolean isComplete() {
    return missingSpecies.isEmpty();
  }

  public boolean isExothermic() {
    return value < 0;
  }

  public boolean isEndothermic() {
    return value > 0;
  }
}
