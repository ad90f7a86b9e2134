package com.quantori.crp.core.model;

import com.quantori.crp.api.ChargeNotation;
import com.quantori.crp.api.MoleculeComposition;
import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/**
 * A reactant, product or catalyst of a {@link Reaction}: a molecule with a positive stoichiometric
 * coefficient, an optional phase override and a catalyst flag. Components are immutable; a reaction
 * replaces a component to change its coefficient or phase.
 */
@Value
public class ReactionComponent {
  @NonNull
  MoleculeComposition molecule;
  double coefficient;
  /**
   * Phase set on the component itself, takes precedence over the molecule phase. Null when unset.
   */
  Phase phaseOverride;
  boolean catalyst;

  public ReactionComponent(MoleculeComposition molecule, double coefficient, Phase phaseOverride, boolean catalyst) {
    if (molecule == null) {
      throw new ValidationException("Reaction component requires a molecule");
    }
    if (!(coefficient > 0) || Double.isInfinite(coefficient)) {
      throw new ValidationException("Coefficient must be positive, got " + coefficient);
    }
    this.molecule = molecule;
    this.coefficient = coefficient;
    this.phaseOverride = phaseOverride == Phase.NONE ? null : phaseOverride;
    this.catalyst = catalyst;
  }

  public ReactionComponent withCoefficient(double newCoefficient) {
    return new ReactionComponent(molecule, newCoefficient, phaseOverride, catalyst);
  }

  public ReactionComponent withPhase(Phase phase) {
    return new ReactionComponent(molecule, coefficient, phase, catalyst);
  }

  /**
   * Effective phase: the override when set, otherwise the molecule phase.
   *
   * @return phase, never null
   */
  public Phase getPhase() {
    return phaseOverride != null ? phaseOverride : molecule.getPhase();
  }

  public String getFormula() {
    return molecule.getFormula();
  }

  public Map<String, Integer> getElements() {
    return molecule.getElements();
  }

  /**
   * Written formula with superscript charge, e.g. {@code Fe²⁺}.
   *
   * @return display label without coefficient and phase
   */
  public String getLabel() {
    return ChargeNotation.superscript(molecule.getNotation(), molecule.getCharge());
  }

  /**
   * Atoms of one element contributed by this component, i.e. {@code coefficient × count}.
   *
   * @param symbol element symbol
   * @return weighted atom count, 0 when the element is absent
   */
  public double atoms(String symbol) {
    return coefficient * molecule.getElements().getOrDefault(symbol, 0);
  }

  /**
   * Formats a coefficient for equations: integral values without decimals, others with at most four
   * significant digits.
   *
   * @param coefficient coefficient
   * @return formatted coefficient
   */
  public static String formatCoefficient(double coefficient) {
    if (Math.abs(coefficient - Math.rint(coefficient)) < 1e-9) {
      return Long.toString(Math.round(coefficient));
    }
    return new BigDecimal(coefficient).round(new MathContext(4)).stripTrailingZeros().toPlainString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (Math.abs(coefficient - 1.0) > 1e-9) {
      sb.append(formatCoefficient(coefficient)).append(' ');
    }
    sb.append(getLabel());
    Phase phase = getPhase();
    if (phase.isKnown()) {
      sb.append('(').append(phase.getSymbol()).append(')');
    }
    return sb.toString();
  }
}
