package com.quantori.crp.core.rule;

import com.quantori.crp.core.model.ReactionComponent;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Element-set overlap tests for two-reactant, two-product reactions.
 */
@UtilityClass
public final class ReplacementPatterns {

  /**
   * {@code A + BC -> AC + B}: one reactant is a single element that shows up in one product while the
   * other product shares an element with the compound.
   *
   * @param reactants non-catalyst reactants
   * @param products  products
   * @return true if the pattern holds
   */
  public static boolean isSingleReplacement(List<ReactionComponent> reactants, List<ReactionComponent> products) {
    if (reactants.size() != 2 || products.size() != 2) {
      return false;
    }
    Set<String> first = reactants.get(0).getElements().keySet();
    Set<String> second = reactants.get(1).getElements().keySet();
    Set<String> element;
    Set<String> compound;
    if (first.size() == 1) {
      element = first;
      compound = second;
    } else if (second.size() == 1) {
      element = second;
      compound = first;
    } else {
      return false;
    }
    String single = element.iterator().next();
    for (int i = 0; i < 2; i++) {
      if (products.get(i).getElements().containsKey(single)
          && overlaps(products.get(1 - i).getElements().keySet(), compound)) {
        return true;
      }
    }
    return false;
  }

  /**
   * {@code AB + CD -> AD + CB}: both reactants are compounds and each reactant shares elements with
   * each product.
   *
   * @param reactants non-catalyst reactants
   * @param products  products
   * @return true if the pattern holds
   */
  public static boolean isDoubleReplacement(List<ReactionComponent> reactants, List<ReactionComponent> products) {
    if (reactants.size() != 2 || products.size() != 2) {
      return false;
    }
    for (ReactionComponent reactant : reactants) {
      if (reactant.getElements().size() < 2) {
        return false;
      }
      for (ReactionComponent product : products) {
        if (!overlaps(reactant.getElements().keySet(), product.getElements().keySet())) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean overlaps(Set<String> left, Set<String> right) {
    Set<String> common = new HashSet<>(left);
    common.retainAll(right);
    return !common.isEmpty();
  }
}
