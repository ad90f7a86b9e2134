package com.quantori.crp.api.element;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Static chemical properties of one element.
 */
@Value
@Builder
public class ElementProperties {
  @NonNull
  String symbol;
  double atomicMass;
  /**
   * Pauling electronegativity, null when not tabulated.
   */
  Double electronegativity;
  @Singular
  List<Integer> oxidationStates;

  public OptionalDouble findElectronegativity() {
    return electronegativity == null ? OptionalDouble.empty() : OptionalDouble.of(electronegativity);
  }

  /**
   * The lowest common oxidation state, e.g. {@code -1} for chlorine.
   *
   * @return most negative common state, empty when none is tabulated
   */
  public OptionalInt mostNegativeOxidationState() {
    return oxidationStates.stream().mapToInt(Integer::intValue).min();
  }
}
