package com.quantori.crp.core.classify;

import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import com.quantori.crp.core.rule.ReplacementPatterns;
import java.util.List;

/**
 * Fallback type derived only from the number of reactants and products and their element sets.
 */
public class CoarseTypeHeuristic {

  public ReactionType classify(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    List<ReactionComponent> products = reaction.getProducts();
    int reactantCount = reactants.size();
    int productCount = products.size();

    if (reactantCount == 1 && productCount == 1) {
      return reactants.get(0).getFormula().equals(products.get(0).getFormula())
          ? ReactionType.ISOMERIZATION
          : ReactionType.UNKNOWN;
    }
    if (reactantCount == 1 && productCount > 1) {
      return ReactionType.DECOMPOSITION;
    }
    if (reactantCount > 1 && productCount == 1) {
      return ReactionType.SYNTHESIS;
    }
    if (reactantCount == 2 && productCount == 2) {
      if (ReplacementPatterns.isSingleReplacement(reactants, products)) {
        return ReactionType.SINGLE_REPLACEMENT;
      }
      if (ReplacementPatterns.isDoubleReplacement(reactants, products)) {
        return ReactionType.DOUBLE_REPLACEMENT;
      }
    }
    return ReactionType.UNKNOWN;
  }
}
