package com.quantori.crp.core.model;

import com.quantori.crp.api.Molecule;
import com.quantori.crp.api.MoleculeComposition;
import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.classify.ClassificationResult;
import com.quantori.crp.core.classify.ReactionAnalysis;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * A chemical reaction: ordered reactants (catalysts interleaved and flagged), ordered products and
 * optional conditions.
 * <p>
 * Catalysts are rendered on the reactant side but take no part in element or mass balance, scaling
 * or normalization. Every mutating call bumps a modification counter; the cached classification is
 * only reused while the counter is unchanged. Instances are not thread-safe.
 */
public class Reaction {

  private static final long NORMALIZATION_SCALE = 1_000_000L;

  @Getter
  private final ReactionEngine engine;
  private final List<ReactionComponent> reactants = new ArrayList<>();
  private final List<ReactionComponent> products = new ArrayList<>();
  private final Map<String, String> conditions = new LinkedHashMap<>();
  @Getter
  private String name;
  @Getter
  private Double temperature;
  @Getter
  private Double pressure;

  @Getter
  private long modificationCount;
  private ClassificationResult cachedClassification;
  private long classifiedAtModification = -1;

  public Reaction() {
    this(ReactionEngine.defaultEngine());
  }

  public Reaction(ReactionEngine engine) {
    this.engine = engine;
  }

  public Reaction addReactant(MoleculeComposition molecule) {
    return addReactant(molecule, 1.0, null, false);
  }

  public Reaction addReactant(MoleculeComposition molecule, double coefficient) {
    return addReactant(molecule, coefficient, null, false);
  }

  public Reaction addReactant(MoleculeComposition molecule, double coefficient, Phase phase) {
    return addReactant(molecule, coefficient, phase, false);
  }

  /**
   * Appends a reactant.
   *
   * @param molecule    molecule
   * @param coefficient positive stoichiometric coefficient
   * @param phase       phase override, null to use the molecule phase
   * @param catalyst    whether the component is a catalyst
   * @return this reaction
   * @throws ValidationException if the coefficient is not positive
   */
  public Reaction addReactant(MoleculeComposition molecule, double coefficient, Phase phase, boolean catalyst) {
    reactants.add(new ReactionComponent(molecule, coefficient, phase, catalyst));
    modified();
    return this;
  }

  public Reaction addReactant(String formula) {
    return addReactant(Molecule.of(formula));
  }

  public Reaction addReactant(String formula, double coefficient) {
    return addReactant(Molecule.of(formula), coefficient);
  }

  public Reaction addReactant(String formula, double coefficient, Phase phase) {
    return addReactant(Molecule.of(formula), coefficient, phase);
  }

  public Reaction addReactant(String formula, double coefficient, Phase phase, boolean catalyst) {
    return addReactant(Molecule.of(formula), coefficient, phase, catalyst);
  }

  public Reaction addCatalyst(MoleculeComposition molecule) {
    return addReactant(molecule, 1.0, null, true);
  }

  public Reaction addProduct(MoleculeComposition molecule) {
    return addProduct(molecule, 1.0, null);
  }

  public Reaction addProduct(MoleculeComposition molecule, double coefficient) {
    return addProduct(molecule, coefficient, null);
  }

  /**
   * Appends a product.
   *
   * @param molecule    molecule
   * @param coefficient positive stoichiometric coefficient
   * @param phase       phase override, null to use the molecule phase
   * @return this reaction
   * @throws ValidationException if the coefficient is not positive
   */
  public Reaction addProduct(MoleculeComposition molecule, double coefficient, Phase phase) {
    products.add(new ReactionComponent(molecule, coefficient, phase, false));
    modified();
    return this;
  }

  public Reaction addProduct(String formula) {
    return addProduct(Molecule.of(formula));
  }

  public Reaction addProduct(String formula, double coefficient) {
    return addProduct(Molecule.of(formula), coefficient);
  }

  public Reaction addProduct(String formula, double coefficient, Phase phase) {
    return addProduct(Molecule.of(formula), coefficient, phase);
  }

  public ReactionComponent removeReactant(int index) {
    ReactionComponent removed = reactants.remove(index);
    modified();
    return removed;
  }

  public ReactionComponent removeProduct(int index) {
    ReactionComponent removed = products.remove(index);
    modified();
    return removed;
  }

  /**
   * All reactant-side components in insertion order, catalysts included.
   *
   * @return unmodifiable list
   */
  public List<ReactionComponent> getReactants() {
    return Collections.unmodifiableList(reactants);
  }

  public List<ReactionComponent> getReactants(boolean includeCatalysts) {
    if (includeCatalysts) {
      return getReactants();
    }
    return reactants.stream().filter(r -> !r.isCatalyst()).collect(Collectors.toUnmodifiableList());
  }

  public List<ReactionComponent> getProducts() {
    return Collections.unmodifiableList(products);
  }

  public List<ReactionComponent> getCatalysts() {
    return reactants.stream().filter(ReactionComponent::isCatalyst).collect(Collectors.toUnmodifiableList());
  }

  public Map<String, String> getConditions() {
    return Collections.unmodifiableMap(conditions);
  }

  public Reaction setName(String name) {
    this.name = name;
    modified();
    return this;
  }

  public Reaction setTemperature(Double temperature) {
    this.temperature = temperature;
    modified();
    return this;
  }

  public Reaction setPressure(Double pressure) {
    this.pressure = pressure;
    modified();
    return this;
  }

  public Reaction setCondition(String key, String value) {
    conditions.put(key, value);
    modified();
    return this;
  }

  /**
   * Net atom count per element, products minus reactants, catalysts excluded.
   *
   * @return element symbol to signed net count, in order of first appearance
   */
  public Map<String, Double> getElementBalance() {
    Map<String, Double> balance = new LinkedHashMap<>();
    for (ReactionComponent reactant : reactants) {
      if (!reactant.isCatalyst()) {
        reactant.getElements().forEach((symbol, count) ->
            balance.merge(symbol, -reactant.getCoefficient() * count, Double::sum));
      }
    }
    for (ReactionComponent product : products) {
      product.getElements().forEach((symbol, count) ->
          balance.merge(symbol, product.getCoefficient() * count, Double::sum));
    }
    return balance;
  }

  public boolean isBalanced() {
    return isBalanced(engine.getProperties().getBalanceTolerance());
  }

  /**
   * Whether every element balance entry is within {@code tolerance} of zero.
   *
   * @param tolerance absolute tolerance
   * @return true if balanced
   */
  public boolean isBalanced(double tolerance) {
    return getElementBalance().values().stream().allMatch(v -> Math.abs(v) < tolerance);
  }

  public Map<String, Double> getUnbalancedElements(double tolerance) {
    return getElementBalance().entrySet().stream()
        .filter(e -> Math.abs(e.getValue()) >= tolerance)
        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
  }

  /**
   * Product mass minus reactant mass, weighted by coefficients, catalysts excluded.
   *
   * @return net molecular weight change
   */
  public double getMolecularWeightBalance() {
    return totalProductMass() - totalReactantMass();
  }

  public double totalReactantMass() {
    return reactants.stream()
        .filter(r -> !r.isCatalyst())
        .mapToDouble(r -> r.getCoefficient() * r.getMolecule().getMolecularWeight())
        .sum();
  }

  public double totalProductMass() {
    return products.stream()
        .mapToDouble(p -> p.getCoefficient() * p.getMolecule().getMolecularWeight())
        .sum();
  }

  public BalanceReport getBalanceReport() {
    return BalanceReport.of(this, engine.getProperties().getBalanceTolerance());
  }

  /**
   * Balances the reaction in place with the smallest positive integer coefficients.
   *
   * @return true once the reaction is balanced
   * @throws com.quantori.crp.core.balance.BalancingException if no conserving coefficients exist
   */
  public boolean balance() {
    return engine.getBalancer().balance(this);
  }

  /**
   * Replaces the coefficients of the non-catalyst reactants followed by the products.
   *
   * @param coefficients new coefficients, one per non-catalyst reactant and product, in order
   * @throws ValidationException if the count does not match or a coefficient is not positive
   */
  public void applyCoefficients(double[] coefficients) {
    long participants = reactants.stream().filter(r -> !r.isCatalyst()).count() + products.size();
    if (coefficients.length != participants) {
      throw new ValidationException("Expected " + participants + " coefficients, got " + coefficients.length);
    }
    int index = 0;
    for (int i = 0; i < reactants.size(); i++) {
      if (!reactants.get(i).isCatalyst()) {
        reactants.set(i, reactants.get(i).withCoefficient(coefficients[index++]));
      }
    }
    for (int i = 0; i < products.size(); i++) {
      products.set(i, products.get(i).withCoefficient(coefficients[index++]));
    }
    modified();
  }

  /**
   * Creates the reverse reaction: products become reactants, reactants become products and catalysts
   * stay on the reactant side. Conditions are copied.
   *
   * @return new reaction sharing the engine
   */
  public Reaction reverse() {
    Reaction reversed = new Reaction(engine);
    reversed.name = name != null ? "Reverse of " + name : null;
    reversed.temperature = temperature;
    reversed.pressure = pressure;
    reversed.conditions.putAll(conditions);
    reversed.reactants.addAll(products);
    reversed.reactants.addAll(getCatalysts());
    reactants.stream().filter(r -> !r.isCatalyst()).forEach(reversed.products::add);
    return reversed;
  }

  /**
   * Multiplies all non-catalyst coefficients by a factor.
   *
   * @param factor positive factor
   * @throws ValidationException if the factor is not positive
   */
  public void scaleCoefficients(double factor) {
    if (!(factor > 0) || Double.isInfinite(factor)) {
      throw new ValidationException("Scaling factor must be positive, got " + factor);
    }
    replaceParticipants(c -> c.withCoefficient(c.getCoefficient() * factor));
  }

  /**
   * Reduces the non-catalyst coefficients to the smallest integer ratio. Coefficients are fixed-point
   * scaled to six decimals, so fractional residues below that resolution are dropped.
   */
  public void normalizeCoefficients() {
    List<ReactionComponent> participants = new ArrayList<>(getReactants(false));
    participants.addAll(products);
    if (participants.isEmpty()) {
      return;
    }
    BigInteger divisor = BigInteger.ZERO;
    for (ReactionComponent participant : participants) {
      divisor = divisor.gcd(BigInteger.valueOf(Math.round(participant.getCoefficient() * NORMALIZATION_SCALE)));
    }
    if (divisor.signum() == 0) {
      return;
    }
    long common = divisor.longValueExact();
    replaceParticipants(c -> c.withCoefficient(
        (double) (Math.round(c.getCoefficient() * NORMALIZATION_SCALE) / common)));
  }

  /**
   * Sets the same phase on every reactant and every product. A null argument leaves that side as is.
   *
   * @param reactantPhase phase for all reactants
   * @param productPhase  phase for all products
   * @return this reaction
   */
  public Reaction setPhases(Phase reactantPhase, Phase productPhase) {
    return setPhases(
        reactantPhase == null ? null : Collections.nCopies(reactants.size(), reactantPhase),
        productPhase == null ? null : Collections.nCopies(products.size(), productPhase));
  }

  /**
   * Sets one phase per component. A null list leaves that side as is.
   *
   * @param reactantPhases phases in reactant order
   * @param productPhases  phases in product order
   * @return this reaction
   * @throws ValidationException if a list size does not match its side
   */
  public Reaction setPhases(List<Phase> reactantPhases, List<Phase> productPhases) {
    if (reactantPhases != null && reactantPhases.size() != reactants.size()) {
      throw new ValidationException("Expected " + reactants.size() + " reactant phases, got " + reactantPhases.size());
    }
    if (productPhases != null && productPhases.size() != products.size()) {
      throw new ValidationException("Expected " + products.size() + " product phases, got " + productPhases.size());
    }
    if (reactantPhases != null) {
      for (int i = 0; i < reactants.size(); i++) {
        reactants.set(i, reactants.get(i).withPhase(reactantPhases.get(i)));
      }
    }
    if (productPhases != null) {
      for (int i = 0; i < products.size(); i++) {
        products.set(i, products.get(i).withPhase(productPhases.get(i)));
      }
    }
    modified();
    return this;
  }

  /**
   * Confidence scores and primary type, cached until the next modification.
   *
   * @return classification, never null
   */
  public ClassificationResult getClassification() {
    if (cachedClassification == null || classifiedAtModification != modificationCount) {
      cachedClassification = engine.getClassifier().classify(this);
      classifiedAtModification = modificationCount;
    }
    return cachedClassification;
  }

  /**
   * Primary reaction type code such as {@code combustion}; {@code unknown} when nothing matched.
   *
   * @return type code, never null
   */
  public String getType() {
    return getClassification().getPrimaryType().code();
  }

  public ReactionAnalysis analyze() {
    return engine.getClassifier().analyze(this);
  }

  private void replaceParticipants(UnaryOperator<ReactionComponent> operator) {
    for (int i = 0; i < reactants.size(); i++) {
      if (!reactants.get(i).isCatalyst()) {
        reactants.set(i, operator.apply(reactants.get(i)));
      }
    }
    products.replaceAll(operator);
    modified();
  }

  private void modified() {
    modificationCount++;
  }

  @Override
  public String toString() {
    if (reactants.isEmpty() && products.isEmpty()) {
      return "Empty reaction";
    }
    String reactantText = joinOrEmpty(getReactants(false), " + ");
    String productText = joinOrEmpty(products, " + ");
    StringBuilder equation = new StringBuilder(reactantText).append(" → ").append(productText);

    List<ReactionComponent> catalysts = getCatalysts();
    if (!catalysts.isEmpty()) {
      equation.append(" [catalyst: ").append(joinOrEmpty(catalysts, ", ")).append(']');
    }

    List<String> conditionTexts = new ArrayList<>();
    if (temperature != null) {
      conditionTexts.add("T=" + ReactionComponent.formatCoefficient(temperature) + "K");
    }
    if (pressure != null) {
      conditionTexts.add("P=" + ReactionComponent.formatCoefficient(pressure) + "atm");
    }
    conditions.forEach((key, value) -> conditionTexts.add(key + "=" + value));
    if (!conditionTexts.isEmpty()) {
      equation.append(" [").append(String.join(", ", conditionTexts)).append(']');
    }
    return equation.toString();
  }

  private static String joinOrEmpty(List<ReactionComponent> components, String delimiter) {
    if (components.isEmpty()) {
      return "∅";
    }
    return components.stream().map(ReactionComponent::toString).collect(Collectors.joining(delimiter));
  }
}
