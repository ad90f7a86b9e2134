package com.quantori.crp.core.oxidation;

import com.quantori.crp.api.MoleculeComposition;
import com.quantori.crp.api.element.ElementProperties;
import com.quantori.crp.api.element.ElementTable;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Assigns oxidation numbers to the elements of one molecule with a fixed rule cascade. Each rule only
 * fills elements that earlier rules left open:
 * <ol>
 *   <li>elemental substances and monatomic ions: charge divided by the atom count</li>
 *   <li>fluorine is -1</li>
 *   <li>oxygen is -2, or -1 in peroxides</li>
 *   <li>hydrogen is +1, or -1 in metal hydrides</li>
 *   <li>in binary compounds the more electronegative element takes its most negative common state</li>
 *   <li>a single remaining element is solved from the charge balance</li>
 * </ol>
 * If more than one element is still open after that, those elements stay unassigned.
 */
public class OxidationStateEstimator {

  private static final String FLUORINE = "F";
  private static final String OXYGEN = "O";
  private static final String HYDROGEN = "H";
  private static final String PEROXIDE_TOKEN = "O2";

  private final AnalysisConfigurationProperties properties;
  private final ElementTable elementTable;

  public OxidationStateEstimator(AnalysisConfigurationProperties properties, ElementTable elementTable) {
    this.properties = properties;
    this.elementTable = elementTable;
  }

  /**
   * Oxidation numbers of the elements that could be resolved.
   *
   * @param molecule molecule to inspect
   * @return element symbol to oxidation number in the molecule's element order; unresolved elements
   *     are absent
   */
  public Map<String, Double> estimate(MoleculeComposition molecule) {
    Map<String, Integer> elements = molecule.getElements();
    Map<String, Double> states = new LinkedHashMap<>();

    if (elements.size() == 1) {
      Map.Entry<String, Integer> only = elements.entrySet().iterator().next();
      states.put(only.getKey(), (double) molecule.getCharge() / only.getValue());
      return Collections.unmodifiableMap(states);
    }

    if (elements.containsKey(FLUORINE)) {
      states.put(FLUORINE, -1.0);
    }
    if (elements.containsKey(OXYGEN)) {
      states.put(OXYGEN, isPeroxide(molecule) ? -1.0 : -2.0);
    }
    if (elements.containsKey(HYDROGEN)) {
      states.put(HYDROGEN, isMetalHydride(molecule) ? -1.0 : 1.0);
    }
    if (elements.size() == 2) {
      assignMostElectronegative(elements, states);
    }

    List<String> open = elements.keySet().stream()
        .filter(symbol -> !states.containsKey(symbol))
        .collect(Collectors.toList());
    if (open.size() == 1) {
      String symbol = open.get(0);
      double assigned = 0.0;
      for (Map.Entry<String, Double> state : states.entrySet()) {
        assigned += state.getValue() * elements.get(state.getKey());
      }
      states.put(symbol, (molecule.getCharge() - assigned) / elements.get(symbol));
    }

    Map<String, Double> ordered = new LinkedHashMap<>();
    elements.keySet().stream()
        .filter(states::containsKey)
        .forEach(symbol -> ordered.put(symbol, states.get(symbol)));
    return Collections.unmodifiableMap(ordered);
  }

  /**
   * Peroxide heuristic: the written formula contains {@code O2} and oxygen is only accompanied by
   * hydrogen or alkali and alkaline-earth metals ({@code H2O2}, {@code Na2O2}, {@code BaO2}).
   */
  boolean isPeroxide(MoleculeComposition molecule) {
    if (!molecule.getNotation().contains(PEROXIDE_TOKEN)) {
      return false;
    }
    return molecule.getElements().keySet().stream()
        .filter(symbol -> !OXYGEN.equals(symbol))
        .allMatch(properties.getPeroxidePartners()::contains);
  }

  /**
   * Hydride heuristic: a hydride-forming metal is present and nothing but hydrogen and such metals
   * ({@code NaH}, {@code CaH2}, {@code LiAlH4}).
   */
  boolean isMetalHydride(MoleculeComposition molecule) {
    boolean hasMetal = false;
    for (String symbol : molecule.getElements().keySet()) {
      if (properties.getHydrideMetals().contains(symbol)) {
        hasMetal = true;
      } else if (!HYDROGEN.equals(symbol)) {
        return false;
      }
    }
    return hasMetal;
  }

  private void assignMostElectronegative(Map<String, Integer> elements, Map<String, Double> states) {
    Iterator<String> symbols = elements.keySet().iterator();
    String first = symbols.next();
    String second = symbols.next();
    OptionalDouble firstElectronegativity = elementTable.electronegativity(first);
    OptionalDouble secondElectronegativity = elementTable.electronegativity(second);
    if (firstElectronegativity.isEmpty() || secondElectronegativity.isEmpty()
        || firstElectronegativity.getAsDouble() == secondElectronegativity.getAsDouble()) {
      return;
    }
    String negative = firstElectronegativity.getAsDouble() > secondElectronegativity.getAsDouble() ? first : second;
    if (states.containsKey(negative)) {
      return;
    }
    OptionalInt state = elementTable.find(negative).map(ElementProperties::mostNegativeOxidationState)
        .orElse(OptionalInt.empty());
    state.ifPresent(value -> states.put(negative, (double) value));
  }
}
