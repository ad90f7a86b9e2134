package com.quantori.crp.core.metrics;

import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mass and mole bookkeeping on reactions. Components are addressed by formula, either the Hill
 * formula or the notation they were written with. Catalysts are ignored throughout.
 */
public class StoichiometryCalculator {

  /**
   * Mass share of the first product among all products, in percent.
   *
   * @param reaction reaction
   * @return atom economy in [0, 100], 0 without products
   */
  public double atomEconomy(Reaction reaction) {
    List<ReactionComponent> products = reaction.getProducts();
    if (products.isEmpty()) {
      return 0.0;
    }
    double total = reaction.totalProductMass();
    if (total == 0.0) {
      return 0.0;
    }
    ReactionComponent desired = products.get(0);
    return desired.getCoefficient() * desired.getMolecule().getMolecularWeight() / total * 100.0;
  }

  /**
   * Relative difference between product and reactant mass, in percent of the reactant mass.
   *
   * @param reaction reaction
   * @return mass balance error, infinite when only products carry mass
   */
  public double massBalanceError(Reaction reaction) {
    double reactantMass = reaction.totalReactantMass();
    double productMass = reaction.totalProductMass();
    if (reactantMass == 0.0) {
      return productMass > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
    }
    return Math.abs(productMass - reactantMass) / reactantMass * 100.0;
  }

  /**
   * Moles of every product formed when the limiting reactant is used up.
   *
   * @param reaction          balanced reaction
   * @param limitingReactant  formula of the limiting reactant
   * @param limitingAmount    moles of the limiting reactant
   * @return product Hill formula to moles, in product order
   * @throws ValidationException if the reaction is not balanced or the reactant is not part of it
   */
  public Map<String, Double> theoreticalYields(Reaction reaction, String limitingReactant, double limitingAmount) {
    requireBalanced(reaction);
    ReactionComponent limiting = findReactant(reaction, limitingReactant)
        .orElseThrow(() -> new ValidationException("Limiting reactant " + limitingReactant + " is not part of " + reaction));
    Map<String, Double> yields = new LinkedHashMap<>();
    for (ReactionComponent product : reaction.getProducts()) {
      yields.merge(product.getFormula(), limitingAmount * product.getCoefficient() / limiting.getCoefficient(),
          Double::sum);
    }
    return yields;
  }

  /**
   * The reactant that runs out first for the given amounts.
   *
   * @param reaction reaction
   * @param amounts  formula to moles available; reactants without an entry are treated as unlimited
   * @return formula of the limiting reactant as given in {@code amounts}, empty when no reactant has
   *     an amount
   */
  public Optional<String> limitingReactant(Reaction reaction, Map<String, Double> amounts) {
    String limiting = null;
    double smallest = Double.POSITIVE_INFINITY;
    for (Map.Entry<String, Double> amount : amounts.entrySet()) {
      Optional<ReactionComponent> reactant = findReactant(reaction, amount.getKey());
      if (reactant.isPresent()) {
        double extent = amount.getValue() / reactant.get().getCoefficient();
        if (extent < smallest) {
          smallest = extent;
          limiting = amount.getKey();
        }
      }
    }
    return Optional.ofNullable(limiting);
  }

  /**
   * Reaction quotient Q: product concentrations over reactant concentrations, each raised to its
   * coefficient. Species without a concentration are left out.
   *
   * @param reaction       balanced reaction
   * @param concentrations formula to concentration in mol/L
   * @return Q, infinite when the denominator is zero
   * @throws ValidationException if the reaction is not balanced
   */
  public double reactionQuotient(Reaction reaction, Map<String, Double> concentrations) {
    requireBalanced(reaction);
    double numerator = 1.0;
    for (ReactionComponent product : reaction.getProducts()) {
      Double concentration = concentrationOf(product, concentrations);
      if (concentration != null) {
        numerator *= Math.pow(concentration, product.getCoefficient());
      }
    }
    double denominator = 1.0;
    for (ReactionComponent reactant : reaction.getReactants(false)) {
      Double concentration = concentrationOf(reactant, concentrations);
      if (concentration != null) {
        denominator *= Math.pow(concentration, reactant.getCoefficient());
      }
    }
    return denominator == 0.0 ? Double.POSITIVE_INFINITY : numerator / denominator;
  }

  /**
   * Reaction order guessed from molecularity: a single reactant or a pair of reactants are first order
   * each, larger reactant sets take their coefficients as orders.
   *
   * @param reaction reaction
   * @return estimated orders, overall order 0 without reactants
   */
  public RateOrderEstimate estimateRateOrder(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    Map<String, Double> orders = new LinkedHashMap<>();
    boolean elementary = reactants.size() <= 2;
    for (ReactionComponent reactant : reactants) {
      orders.merge(reactant.getFormula(), elementary ? 1.0 : reactant.getCoefficient(), Double::sum);
    }
    double overall = orders.values().stream().mapToDouble(Double::doubleValue).sum();
    return new RateOrderEstimate(overall, Collections.unmodifiableMap(orders));
  }

  private static void requireBalanced(Reaction reaction) {
    if (!reaction.isBalanced()) {
      throw new ValidationException("Reaction must be balanced: " + reaction);
    }
  }

  private static Optional<ReactionComponent> findReactant(Reaction reaction, String formula) {
    return reaction.getReactants(false).stream().filter(r -> matches(r, formula)).findFirst();
  }

  private static Double concentrationOf(ReactionComponent component, Map<String, Double> concentrations) {
    Double byFormula = concentrations.get(component.getFormula());
    return byFormula != null ? byFormula : concentrations.get(component.getMolecule().getNotation());
  }

  private static boolean matches(ReactionComponent component, String formula) {
    return formula.equals(component.getFormula()) || formula.equals(component.getMolecule().getNotation());
  }
}
