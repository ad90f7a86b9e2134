package com.quantori.crp.core.balance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Suggested order for balancing a reaction by hand: start with the species that holds the most
 * elements, then fix elements from the fewest to the most species they occur in.
 */
@Value
@Builder
public class BalancingHint {

  public enum Side {
    REACTANT,
    PRODUCT
  }

  boolean balanced;
  /**
   * Net count, products minus reactants, of every unbalanced element.
   */
  Map<String, Double> unbalancedElements;
  /**
   * Label of the species to start with, null for a balanced or empty reaction.
   */
  String startingSpecies;
  Side startingSide;
  /**
   * Unbalanced elements with the number of species containing them, ascending by that number.
   */
  Map<String, Integer> elementOrder;

  /**
   * Human readable steps.
   *
   * @return one line per step
   */
  public List<String> toLines() {
    List<String> lines = new ArrayList<>();
    if (balanced) {
      lines.add("Reaction is already balanced!");
      return lines;
    }
    lines.add("Unbalanced elements found:");
    unbalancedElements.forEach((element, imbalance) -> lines.add(imbalance > 0
        ? String.format(Locale.ROOT, "  - %s: excess in products (+%.3f)", element, imbalance)
        : String.format(Locale.ROOT, "  - %s: excess in reactants (%.3f)", element, imbalance)));
    if (startingSpecies != null) {
      lines.add("Start by balancing the most complex molecule:");
      lines.add("  - " + startingSpecies + " (" + startingSide.name().toLowerCase(Locale.ROOT) + ")");
    }
    if (!elementOrder.isEmpty()) {
      lines.add("Suggested balancing order (least to most complex):");
      elementOrder.forEach((element, species) -> lines.add("  - " + element + " (appears in " + species + " molecules)"));
    }
    return lines;
  }
}
