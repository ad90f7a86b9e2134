package com.quantori.crp.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of how well a reaction conserves atoms and mass.
 */
@Value
@Builder
public class BalanceReport {
  boolean balanced;
  Map<String, Double> elementBalance;
  Set<String> balancedElements;
  Map<String, Double> unbalancedElements;
  double massBalance;
  double totalReactantMass;
  double totalProductMass;
  int reactantCount;
  int productCount;
  int catalystCount;

  static BalanceReport of(Reaction reaction, double tolerance) {
    Map<String, Double> balance = reaction.getElementBalance();
    Map<String, Double> unbalanced = new LinkedHashMap<>();
    Set<String> balanced = new TreeSet<>();
    balance.forEach((symbol, net) -> {
      if (Math.abs(net) < tolerance) {
        balanced.add(symbol);
      } else {
        unbalanced.put(symbol, net);
      }
    });
    return BalanceReport.builder()
        .balanced(unbalanced.isEmpty())
        .elementBalance(balance)
        .balancedElements(balanced)
        .unbalancedElements(unbalanced)
        .massBalance(reaction.getMolecularWeightBalance())
        .totalReactantMass(reaction.totalReactantMass())
        .totalProductMass(reaction.totalProductMass())
        .reactantCount(reaction.getReactants(false).size())
        .productCount(reaction.getProducts().size())
        .catalystCount(reaction.getCatalysts().size())
        .build();
  }
}
