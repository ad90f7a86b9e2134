package com.quantori.crp.core.oxidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.quantori.crp.api.Molecule;
import com.quantori.crp.api.element.ElementTable;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class OxidationStateEstimatorTest {

  private final OxidationStateEstimator estimator =
      new OxidationStateEstimator(AnalysisConfigurationProperties.defaults(), ElementTable.defaultTable());

  private static Stream<Arguments> molecules() {
    return Stream.of(
        Arguments.of("H2O", Map.of("H", 1.0, "O", -2.0)),
        Arguments.of("H2O2", Map.of("H", 1.0, "O", -1.0)),
        Arguments.of("Na2O2", Map.of("Na", 1.0, "O", -1.0)),
        Arguments.of("CO2", Map.of("C", 4.0, "O", -2.0)),
        Arguments.of("CH4", Map.of("C", -4.0, "H", 1.0)),
        Arguments.of("NaH", Map.of("H", -1.0, "Na", 1.0)),
        Arguments.of("CaH2", Map.of("Ca", 2.0, "H", -1.0)),
        Arguments.of("NaOH", Map.of("H", 1.0, "Na", 1.0, "O", -2.0)),
        Arguments.of("Ca(OH)2", Map.of("Ca", 2.0, "H", 1.0, "O", -2.0)),
        Arguments.of("HCl", Map.of("Cl", -1.0, "H", 1.0)),
        Arguments.of("NaCl", Map.of("Cl", -1.0, "Na", 1.0)),
        Arguments.of("NH3", Map.of("H", 1.0, "N", -3.0)),
        Arguments.of("HF", Map.of("F", -1.0, "H", 1.0)),
        Arguments.of("SO4^2-", Map.of("O", -2.0, "S", 6.0)),
        Arguments.of("MnO4^-", Map.of("Mn", 7.0, "O", -2.0)),
        Arguments.of("O2", Map.of("O", 0.0)),
        Arguments.of("Fe^3+", Map.of("Fe", 3.0)),
        Arguments.of("Hg2^2+", Map.of("Hg", 1.0)),
        Arguments.of("C2H5OH", Map.of("C", -2.0, "H", 1.0, "O", -2.0))
    );
  }

  @ParameterizedTest
  @MethodSource("molecules")
  void assignsOxidationStates(String formula, Map<String, Double> expected) {
    assertThat(estimator.estimate(Molecule.of(formula))).isEqualTo(expected);
  }

  @Test
  void leavesSeveralOpenElementsUnresolved() {
    assertThat(estimator.estimate(Molecule.of("ZnSO4"))).containsOnly(entry("O", -2.0));
    assertThat(estimator.estimate(Molecule.of("KMnO4"))).containsOnly(entry("O", -2.0));
  }

  @Test
  void doesNotTreatCarbonDioxideOrHydroxidesAsPeroxides() {
    assertThat(estimator.isPeroxide(Molecule.of("CO2"))).isFalse();
    assertThat(estimator.isPeroxide(Molecule.of("Ca(OH)2"))).isFalse();
    assertThat(estimator.isPeroxide(Molecule.of("BaO2"))).isTrue();
  }

  @Test
  void recognizesMetalHydridesOnly() {
    assertThat(estimator.isMetalHydride(Molecule.of("LiAlH4"))).isTrue();
    assertThat(estimator.isMetalHydride(Molecule.of("NaOH"))).isFalse();
    assertThat(estimator.isMetalHydride(Molecule.of("H2"))).isFalse();
  }
}
