package com.quantori.crp.core.balance;

import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the {@link StoichiometricMatrix} of a reaction. Catalysts are not part of the matrix.
 */
public class StoichiometricMatrixBuilder {

  public StoichiometricMatrix build(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    List<ReactionComponent> products = reaction.getProducts();

    Set<String> reactantElements = new TreeSet<>();
    reactants.forEach(r -> reactantElements.addAll(r.getElements().keySet()));
    Set<String> productElements = new TreeSet<>();
    products.forEach(p -> productElements.addAll(p.getElements().keySet()));

    Set<String> allElements = new TreeSet<>(reactantElements);
    allElements.addAll(productElements);
    List<String> elements = List.copyOf(allElements);

    List<ReactionComponent> columns = new ArrayList<>(reactants);
    columns.addAll(products);

    int[][] counts = new int[elements.size()][columns.size()];
    for (int row = 0; row < elements.size(); row++) {
      String symbol = elements.get(row);
      for (int col = 0; col < columns.size(); col++) {
        int count = columns.get(col).getElements().getOrDefault(symbol, 0);
        counts[row][col] = col < reactants.size() ? count : -count;
      }
    }
    return new StoichiometricMatrix(elements, List.copyOf(columns), reactants.size(), counts,
        Set.copyOf(reactantElements), Set.copyOf(productElements));
  }
}
