package com.quantori.crp.core.balance;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.crp.api.Molecule;
import com.quantori.crp.core.model.Reaction;
import org.junit.jupiter.api.Test;

class StoichiometricMatrixBuilderTest {

  private final StoichiometricMatrixBuilder builder = new StoichiometricMatrixBuilder();

  @Test
  void buildsSignedMatrixWithSortedElementRows() {
    Reaction reaction = new Reaction()
        .addReactant("CH4")
        .addReactant("O2")
        .addCatalyst(Molecule.of("Pt"))
        .addProduct("CO2")
        .addProduct("H2O");

    StoichiometricMatrix matrix = builder.build(reaction);

    assertThat(matrix.getElements()).containsExactly("C", "H", "O");
    assertThat(matrix.cols()).isEqualTo(4);
    assertThat(matrix.getReactantColumns()).isEqualTo(2);
    assertThat(matrix.getCounts()).isDeepEqualTo(new int[][] {
        {1, 0, -1, 0},
        {4, 0, 0, -2},
        {0, 2, -2, -1}
    });
    assertThat(matrix.unmatchedElements()).isEmpty();
    assertThat(matrix.conserves(new long[] {1, 2, 1, 2})).isTrue();
    assertThat(matrix.conserves(new long[] {1, 1, 1, 1})).isFalse();
  }

  @Test
  void reportsElementsPresentOnOneSideOnly() {
    Reaction reaction = new Reaction()
        .addReactant("Na")
        .addReactant("H2O")
        .addProduct("NaCl");

    assertThat(builder.build(reaction).unmatchedElements()).containsExactly("Cl", "H", "O");
  }
}
