package com.quantori.crp.core.balance;

/**
 * Thrown when no set of positive integer coefficients conserves every element of a reaction, or when
 * the reaction lacks reactants or products to balance.
 */
public class BalancingException extends RuntimeException {
  /**
   * Constructs a {@code BalancingException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public BalancingException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code BalancingException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public BalancingException(String message, Throwable cause) {
    super(message, cause);
  }
}
