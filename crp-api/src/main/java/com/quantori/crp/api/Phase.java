package com.quantori.crp.api;

import java.util.Arrays;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Physical phase of a reaction participant.
 */
public enum Phase {
  /**
   * Solid, {@code (s)}
   */
  SOLID("s", "solid"),
  /**
   * Liquid, {@code (l)}
   */
  LIQUID("l", "liquid"),
  /**
   * Gas, {@code (g)}
   */
  GAS("g", "gas"),
  /**
   * Aqueous solution, {@code (aq)}
   */
  AQUEOUS("aq", "aqueous"),
  /**
   * Phase is not known or not relevant
   */
  NONE("", "none");

  private final String symbol;
  private final String longName;

  Phase(String symbol, String longName) {
    this.symbol = symbol;
    this.longName = longName;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isKnown() {
    return this != NONE;
  }

  /**
   * Resolves a phase from its short symbol ({@code aq}) or its name ({@code aqueous}), case-insensitive.
   * A blank value resolves to {@link #NONE}.
   *
   * @param value phase symbol or name
   * @return the phase
   * @throws ValidationException if the value names no phase
   */
  public static Phase of(String value) {
    if (StringUtils.isBlank(value)) {
      return NONE;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(p -> p.symbol.equals(normalized) || p.longName.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new ValidationException("Unknown phase: " + value));
  }
}
