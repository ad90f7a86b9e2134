package com.quantori.crp.core.group;

import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Text-pattern functional group analysis. This is a heuristic over written formulas, not a structural
 * analysis.
 */
public class FunctionalGroupAnalyzer {

  public FunctionalGroupAnalysis analyze(Reaction reaction) {
    Map<FunctionalGroup, Double> reactantGroups = countGroups(reaction.getReactants(false));
    Map<FunctionalGroup, Double> productGroups = countGroups(reaction.getProducts());

    List<GroupTransformation> transformations = new ArrayList<>();
    reactantGroups.forEach((consumed, before) -> {
      if (before > productGroups.getOrDefault(consumed, 0.0)) {
        productGroups.forEach((formed, after) -> {
          if (after > reactantGroups.getOrDefault(formed, 0.0)) {
            transformations.add(GroupTransformation.of(consumed, formed));
          }
        });
      }
    });

    OrganicMechanism mechanism = OrganicMechanism.of(new LinkedHashSet<>(transformations));
    return new FunctionalGroupAnalysis(Collections.unmodifiableMap(reactantGroups),
        Collections.unmodifiableMap(productGroups), List.copyOf(transformations), mechanism);
  }

  /**
   * Sums coefficients of the components in which each group is present.
   *
   * @param components reaction components
   * @return group to weighted count, only groups that are present
   */
  public Map<FunctionalGroup, Double> countGroups(List<ReactionComponent> components) {
    Map<FunctionalGroup, Double> counts = new EnumMap<>(FunctionalGroup.class);
    for (ReactionComponent component : components) {
      for (FunctionalGroup group : FunctionalGroup.values()) {
        if (group.isPresentIn(component.getMolecule())) {
          counts.merge(group, component.getCoefficient(), Double::sum);
        }
      }
    }
    return counts;
  }
}
