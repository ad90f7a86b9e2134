package com.quantori.crp.core.balance;

import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.math.Fraction;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * Balances reactions by computing the null space of the signed stoichiometric matrix.
 * <p>
 * The right singular vector of the smallest singular value is rescaled to positive values, each entry
 * is turned into a fraction with a bounded denominator and the fractions are brought to the smallest
 * integer ratio. The result is accepted only if it conserves every element exactly.
 */
@Slf4j
public class NullSpaceBalancer {

  private static final int MAX_DENOMINATOR = 10_000;

  private final AnalysisConfigurationProperties properties;
  private final StoichiometricMatrixBuilder matrixBuilder;

  public NullSpaceBalancer(AnalysisConfigurationProperties properties, StoichiometricMatrixBuilder matrixBuilder) {
    this.properties = properties;
    this.matrixBuilder = matrixBuilder;
  }

  /**
   * Balances a reaction in place. Catalyst coefficients are not touched and an already balanced
   * reaction is left as it is.
   *
   * @param reaction reaction to balance
   * @return true once the reaction is balanced
   * @throws BalancingException if a side is empty, an element occurs on one side only or no positive
   *                            integer solution exists
   */
  public boolean balance(Reaction reaction) {
    if (reaction.getReactants(false).isEmpty() || reaction.getProducts().isEmpty()) {
      throw new BalancingException("Reaction must have at least one reactant and one product: " + reaction);
    }
    if (reaction.isBalanced(properties.getBalanceTolerance())) {
      log.debug("Reaction {} is already balanced", reaction);
      return true;
    }

    StoichiometricMatrix matrix = matrixBuilder.build(reaction);
    Set<String> unmatched = matrix.unmatchedElements();
    if (!unmatched.isEmpty()) {
      throw new BalancingException("Elements " + unmatched + " appear on only one side of " + reaction);
    }

    long[] coefficients = solve(matrix);
    reaction.applyCoefficients(Arrays.stream(coefficients).asDoubleStream().toArray());
    log.debug("Balanced reaction {}", reaction);
    return true;
  }

  /**
   * Steps for balancing a reaction by hand. The reaction is not modified.
   *
   * @param reaction reaction to inspect
   * @return balancing hint
   */
  public BalancingHint suggest(Reaction reaction) {
    double tolerance = properties.getBalanceTolerance();
    if (reaction.isBalanced(tolerance)) {
      return BalancingHint.builder()
          .balanced(true)
          .unbalancedElements(Map.of())
          .elementOrder(Map.of())
          .build();
    }
    Map<String, Double> unbalanced = reaction.getUnbalancedElements(tolerance);

    List<ReactionComponent> species = new ArrayList<>(reaction.getReactants(false));
    species.addAll(reaction.getProducts());
    int reactantCount = reaction.getReactants(false).size();
    int startIndex = -1;
    for (int i = 0; i < species.size(); i++) {
      if (startIndex < 0 || species.get(i).getElements().size() > species.get(startIndex).getElements().size()) {
        startIndex = i;
      }
    }

    Map<String, Integer> occurrences = new LinkedHashMap<>();
    unbalanced.keySet().forEach(element -> occurrences.put(element,
        (int) species.stream().filter(s -> s.getElements().containsKey(element)).count()));
    Map<String, Integer> order = new LinkedHashMap<>();
    occurrences.entrySet().stream()
        .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
        .forEachOrdered(e -> order.put(e.getKey(), e.getValue()));

    BalancingHint.BalancingHintBuilder hint = BalancingHint.builder()
        .balanced(false)
        .unbalancedElements(unbalanced)
        .elementOrder(order);
    if (startIndex >= 0) {
      hint.startingSpecies(species.get(startIndex).getLabel())
          .startingSide(startIndex < reactantCount ? BalancingHint.Side.REACTANT : BalancingHint.Side.PRODUCT);
    }
    return hint.build();
  }

  /**
   * Smallest positive integer vector in the null space of the matrix.
   *
   * @param matrix stoichiometric matrix
   * @return one coefficient per column
   * @throws BalancingException if the null space holds no strictly positive vector
   */
  long[] solve(StoichiometricMatrix matrix) {
    log.debug("Solving stoichiometric matrix {}x{} over elements {}", matrix.rows(), matrix.cols(),
        matrix.getElements());
    double[] vector = nullVector(matrix);
    double[] scaled = toPositiveRatios(vector);
    long[] coefficients;
    try {
      coefficients = toIntegers(scaled);
      if (!matrix.conserves(coefficients)) {
        throw new BalancingException("Coefficients " + Arrays.toString(coefficients) + " do not conserve "
            + matrix.getElements());
      }
    } catch (ArithmeticException e) {
      throw new BalancingException("Coefficients cannot be represented as integers", e);
    }
    if (Arrays.stream(coefficients).anyMatch(c -> c <= 0)) {
      throw new BalancingException("No strictly positive coefficients exist, got " + Arrays.toString(coefficients));
    }
    return coefficients;
  }

  private double[] nullVector(StoichiometricMatrix matrix) {
    DMatrixRMaj m = matrix.toDMatrix();
    SingularValueDecomposition_F64<DMatrixRMaj> svd =
        DecompositionFactory_DDRM.svd(m.numRows, m.numCols, false, true, false);
    if (!svd.decompose(m)) {
      throw new BalancingException("Singular value decomposition did not converge");
    }
    DMatrixRMaj v = svd.getV(null, false);
    double[] singularValues = svd.getSingularValues();
    int count = svd.numberOfSingularValues();

    int column;
    double smallest;
    if (v.numCols > count) {
      // columns past the decomposed values span the null space directly
      column = count;
      smallest = 0.0;
    } else {
      column = 0;
      for (int i = 1; i < count; i++) {
        if (singularValues[i] < singularValues[column]) {
          column = i;
        }
      }
      smallest = singularValues[column];
    }
    double largest = Arrays.stream(singularValues, 0, count).max().orElse(0.0);
    log.debug("Smallest singular value {} (largest {})", smallest, largest);
    if (smallest > properties.getBalanceTolerance() * Math.max(1.0, largest)) {
      throw new BalancingException("Reaction cannot be balanced: the stoichiometric matrix has full column rank");
    }

    double[] vector = new double[v.numRows];
    for (int row = 0; row < v.numRows; row++) {
      vector[row] = v.get(row, column);
    }
    return vector;
  }

  private double[] toPositiveRatios(double[] vector) {
    double sum = Arrays.stream(vector).sum();
    double sign = sum < 0 ? -1.0 : 1.0;
    double clamp = properties.getZeroClamp();
    double[] positive = new double[vector.length];
    double minimum = Double.MAX_VALUE;
    for (int i = 0; i < vector.length; i++) {
      double value = vector[i] * sign;
      if (value < -clamp) {
        throw new BalancingException("Null space vector has mixed signs: " + Arrays.toString(vector));
      }
      positive[i] = Math.max(value, clamp);
      if (positive[i] > clamp) {
        minimum = Math.min(minimum, positive[i]);
      }
    }
    if (minimum == Double.MAX_VALUE) {
      throw new BalancingException("Null space vector is zero");
    }
    for (int i = 0; i < positive.length; i++) {
      positive[i] /= minimum;
    }
    return positive;
  }

  private static long[] toIntegers(double[] ratios) {
    Fraction[] fractions = new Fraction[ratios.length];
    long denominator = 1;
    for (int i = 0; i < ratios.length; i++) {
      fractions[i] = Fraction.getFraction(ratios[i]);
      if (fractions[i].getDenominator() > MAX_DENOMINATOR) {
        throw new ArithmeticException("Denominator of " + ratios[i] + " exceeds " + MAX_DENOMINATOR);
      }
      denominator = lcm(denominator, fractions[i].getDenominator());
    }
    long[] integers = new long[ratios.length];
    long divisor = 0;
    for (int i = 0; i < ratios.length; i++) {
      integers[i] = Math.multiplyExact(fractions[i].getNumerator(), denominator / fractions[i].getDenominator());
      divisor = gcd(divisor, Math.abs(integers[i]));
    }
    if (divisor > 1) {
      for (int i = 0; i < integers.length; i++) {
        integers[i] /= divisor;
      }
    }
    return integers;
  }

  private static long lcm(long a, long b) {
    return Math.multiplyExact(a / gcd(a, b), b);
  }

  private static long gcd(long a, long b) {
    while (b != 0) {
      long t = a % b;
      a = b;
      b = t;
    }
    return a;
  }
}
