package com.quantori.crp.core.balance;

import com.quantori.crp.core.model.ReactionComponent;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * Signed element-by-component count matrix. Rows are elements in alphabetical order, columns are the
 * non-catalyst reactants followed by the products; reactant entries are positive and product entries
 * negative, so conserving coefficient vectors are exactly its null space.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class StoichiometricMatrix {
  private final List<String> elements;
  private final List<ReactionComponent> columns;
  private final int reactantColumns;
  private final int[][] counts;
  private final Set<String> reactantElements;
  private final Set<String> productElements;

  public int rows() {
    return elements.size();
  }

  public int cols() {
    return columns.size();
  }

  public int get(int row, int col) {
    return counts[row][col];
  }

  /**
   * Elements that occur on only one side of the reaction.
   *
   * @return sorted symbols, empty when both sides share the same elements
   */
  public Set<String> unmatchedElements() {
    Set<String> unmatched = new TreeSet<>(reactantElements);
    unmatched.addAll(productElements);
    Set<String> common = new TreeSet<>(reactantElements);
    common.retainAll(productElements);
    unmatched.removeAll(common);
    return unmatched;
  }

  DMatrixRMaj toDMatrix() {
    DMatrixRMaj matrix = new DMatrixRMaj(rows(), cols());
    for (int row = 0; row < rows(); row++) {
      for (int col = 0; col < cols(); col++) {
        matrix.set(row, col, counts[row][col]);
      }
    }
    return matrix;
  }

  /**
   * Whether an integer vector conserves every element exactly.
   *
   * @param coefficients one coefficient per column
   * @return true if every row sums to zero
   * @throws ArithmeticException if the products overflow a long
   */
  boolean conserves(long[] coefficients) {
    for (int[] row : counts) {
      long sum = 0;
      for (int col = 0; col < row.length; col++) {
        sum = Math.addExact(sum, Math.multiplyExact((long) row[col], coefficients[col]));
      }
      if (sum != 0) {
        return false;
      }
    }
    return true;
  }
}
