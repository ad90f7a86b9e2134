package com.quantori.crp.core.oxidation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.Value;

/**
 * Averaged oxidation numbers of each reaction side. Elements that could not be resolved in any
 * molecule of a side are missing from that side's map.
 */
@Value
public class OxidationStateAssignment {
  Map<String, Double> reactantStates;
  Map<String, Double> productStates;

  /**
   * Change of the averaged oxidation number from reactants to products.
   *
   * @param symbol element symbol
   * @return product minus reactant state, empty unless both sides are resolved
   */
  public OptionalDouble change(String symbol) {
    Double before = reactantStates.get(symbol);
    Double after = productStates.get(symbol);
    if (before == null || after == null) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(after - before);
  }

  /**
   * Elements whose averaged state moves by more than {@code threshold}.
   *
   * @param threshold minimum absolute change
   * @return symbol to signed change, in reactant order
   */
  public Map<String, Double> changesAbove(double threshold) {
    Map<String, Double> changes = new LinkedHashMap<>();
    reactantStates.keySet().forEach(symbol -> change(symbol).ifPresent(delta -> {
      if (Math.abs(delta) > threshold) {
        changes.put(symbol, delta);
      }
    }));
    return changes;
  }
}
