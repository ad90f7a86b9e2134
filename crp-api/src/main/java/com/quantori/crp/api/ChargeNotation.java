package com.quantori.crp.api;

import lombok.experimental.UtilityClass;

/**
 * Renders ionic charges either with Unicode superscripts ({@code Fe²⁺}) for display or with a caret
 * ({@code Fe^2+}) for text that has to be parsed back by {@link FormulaParser}.
 */
@UtilityClass
public final class ChargeNotation {

  static final String SUPERSCRIPT_DIGITS = "⁰¹²³⁴⁵⁶⁷⁸⁹";
  static final char SUPERSCRIPT_PLUS = '⁺';
  static final char SUPERSCRIPT_MINUS = '⁻';

  /**
   * Appends a superscript charge, e.g. {@code Ce} and {@code 4} give {@code Ce⁴⁺}. A unit charge is
   * rendered without a digit ({@code Na⁺}).
   *
   * @param formula formula without charge
   * @param charge  signed charge
   * @return display notation
   */
  public static String superscript(String formula, int charge) {
    if (charge == 0) {
      return formula;
    }
    StringBuilder sb = new StringBuilder(formula);
    int magnitude = Math.abs(charge);
    if (magnitude != 1) {
      for (char digit : Integer.toString(magnitude).toCharArray()) {
        sb.append(SUPERSCRIPT_DIGITS.charAt(digit - '0'));
      }
    }
    sb.append(charge > 0 ? SUPERSCRIPT_PLUS : SUPERSCRIPT_MINUS);
    return sb.toString();
  }

  /**
   * Appends a caret charge, e.g. {@code SO4} and {@code -2} give {@code SO4^2-}.
   *
   * @param formula formula without charge
   * @param charge  signed charge
   * @return parsable notation
   */
  public static String caret(String formula, int charge) {
    if (charge == 0) {
      return formula;
    }
    int magnitude = Math.abs(charge);
    return formula + "^" + (magnitude == 1 ? "" : Integer.toString(magnitude)) + (charge > 0 ? "+" : "-");
  }
}
