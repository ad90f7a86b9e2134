package com.quantori.crp.api;

import com.quantori.crp.api.element.ElementTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Formula-backed {@link MoleculeComposition}. Instances are immutable; equality is by composition,
 * charge and phase, so {@code CH3COOH} equals {@code C2H4O2}.
 */
@Getter
@EqualsAndHashCode(of = {"elements", "charge", "phase"})
public final class Molecule implements MoleculeComposition {

  private static final String CARBON = "C";
  private static final String HYDROGEN = "H";

  private final Map<String, Integer> elements;
  private final String formula;
  private final String notation;
  private final int charge;
  private final Phase phase;
  private final double molecularWeight;

  private Molecule(Map<String, Integer> elements, String notation, int charge, Phase phase, ElementTable table) {
    if (elements.isEmpty()) {
      throw new ValidationException("Molecule must contain at least one element");
    }
    Map<String, Integer> ordered = new LinkedHashMap<>();
    for (String symbol : hillOrder(elements.keySet())) {
      int count = elements.get(symbol);
      if (count <= 0) {
        throw new ValidationException("Atom count of " + symbol + " must be positive, got " + count);
      }
      ordered.put(symbol, count);
    }
    this.elements = Collections.unmodifiableMap(ordered);
    this.formula = render(ordered);
    this.notation = notation == null ? formula : notation;
    this.charge = charge;
    this.phase = phase == null ? Phase.NONE : phase;
    this.molecularWeight = ordered.entrySet().stream()
        .mapToDouble(e -> table.atomicMass(e.getKey()) * e.getValue())
        .sum();
  }

  /**
   * Parses a formula with the default element table, e.g. {@code Ca(OH)2} or {@code Fe^3+}.
   *
   * @param formula formula text
   * @return molecule without a phase
   */
  public static Molecule of(String formula) {
    return of(formula, Phase.NONE);
  }

  public static Molecule of(String formula, Phase phase) {
    FormulaParser.ParsedFormula parsed = new FormulaParser().parse(formula);
    return new Molecule(parsed.getElements(), parsed.getNotation(), parsed.getCharge(), phase,
        ElementTable.defaultTable());
  }

  /**
   * Creates a molecule from an explicit composition.
   *
   * @param elements element symbol to positive count
   * @param charge   net charge
   * @param phase    phase, null for none
   * @return molecule whose notation is its Hill formula
   */
  public static Molecule fromElements(Map<String, Integer> elements, int charge, Phase phase) {
    ElementTable table = ElementTable.defaultTable();
    elements.keySet().forEach(table::get);
    return new Molecule(elements, null, charge, phase, table);
  }

  public Molecule withPhase(Phase newPhase) {
    return new Molecule(elements, notation, charge, newPhase, ElementTable.defaultTable());
  }

  /**
   * Hill system order: carbon first, then hydrogen, then the rest alphabetically; without carbon all
   * symbols are alphabetical.
   *
   * @param symbols element symbols
   * @return ordered symbols
   */
  static List<String> hillOrder(Iterable<String> symbols) {
    List<String> ordered = new ArrayList<>();
    symbols.forEach(ordered::add);
    Collections.sort(ordered);
    if (ordered.contains(CARBON)) {
      ordered.remove(CARBON);
      ordered.add(0, CARBON);
      if (ordered.remove(HYDROGEN)) {
        ordered.add(1, HYDROGEN);
      }
    }
    return ordered;
  }

  private static String render(Map<String, Integer> elements) {
    StringBuilder sb = new StringBuilder();
    elements.forEach((symbol, count) -> {
      sb.append(symbol);
      if (count > 1) {
        sb.append(count);
      }
    });
    return sb.toString();
  }

  @Override
  public String toString() {
    String text = ChargeNotation.superscript(notation, charge);
    return phase.isKnown() ? text + "(" + phase.getSymbol() + ")" : text;
  }
}
