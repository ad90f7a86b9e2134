package com.quantori.crp.api;

/**
 * Thrown when an input to the reaction platform is structurally invalid: a non-positive stoichiometric
 * coefficient, an empty or malformed formula, an unknown element symbol, or an unparsable equation or
 * reaction document.
 */
public class ValidationException extends RuntimeException {
  /**
   * Constructs a {@code ValidationException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public ValidationException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code ValidationException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
