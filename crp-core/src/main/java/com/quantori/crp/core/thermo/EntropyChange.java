package com.quantori.crp.core.thermo;

import java.util.List;
import lombok.Value;

/**
 * Reaction entropy in J/(mol K).
 */
@Value
public class EntropyChange {
  double value;
  double temperature;
  List<String> missingSpecies;

  public boolean isComplete() {
    return missingSpecies.isEmpty();
  }

  public boolean isIncrease() {
    return value > 0;
  }

  public boolean isDecrease() {
    return value < 0;
  }
}
