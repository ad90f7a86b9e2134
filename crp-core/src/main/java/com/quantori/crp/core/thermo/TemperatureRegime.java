package com.quantori.crp.core.thermo;

import lombok.Getter;

/**
 * Temperature range in which a reaction is spontaneous, from the signs of ΔH and ΔS.
 */
@Getter
public enum TemperatureRegime {
  SPONTANEOUS_AT_ALL_TEMPERATURES("spontaneous at all temperatures", "Reaction is thermodynamically favorable"),
  NON_SPONTANEOUS_AT_ALL_TEMPERATURES("non-spontaneous at all temperatures", "Reaction requires external energy input"),
  SPONTANEOUS_AT_LOW_TEMPERATURES("spontaneous at low temperatures", "Lower temperature favors this reaction"),
  SPONTANEOUS_AT_HIGH_TEMPERATURES("spontaneous at high temperatures", "Higher temperature favors this reaction"),
  UNDETERMINED("undetermined", "Insufficient thermodynamic data for analysis");

  private final String description;
  private final String recommendation;

  TemperatureRegime(String description, String recommendation) {
    this.description = description;
    this.recommendation = recommendation;
  }

  public static TemperatureRegime of(double enthalpy, double entropy) {
    if (enthalpy < 0 && entropy > 0) {
      return SPONTANEOUS_AT_ALL_TEMPERATURES;
    }
    if (enthalpy > 0 && entropy < 0) {
      return NON_SPONTANEOUS_AT_ALL_TEMPERATURES;
    }
    if (enthalpy < 0 && entropy < 0) {
      return SPONTANEOUS_AT_LOW_TEMPERATURES;
    }
    if (enthalpy > 0 && entropy > 0) {
      return SPONTANEOUS_AT_HIGH_TEMPERATURES;
    }
    return UNDETERMINED;
  }

  /**
   * Whether ΔG changes sign at {@code ΔH / ΔS}.
   *
   * @return true for the low and high temperature regimes
   */
  public boolean hasCrossover() {
    return this == SPONTANEOUS_AT_LOW_TEMPERATURES || this == SPONTANEOUS_AT_HIGH_TEMPERATURES;
  }
}
