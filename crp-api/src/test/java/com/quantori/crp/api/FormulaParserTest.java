package com.quantori.crp.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class FormulaParserTest {

  private final FormulaParser parser = new FormulaParser();

  @Test
  void parsesSimpleFormula() {
    var parsed = parser.parse("H2O");
    assertThat(parsed.getElements()).containsExactly(entry("H", 2), entry("O", 1));
    assertThat(parsed.getCharge()).isZero();
    assertThat(parsed.getNotation()).isEqualTo("H2O");
  }

  @Test
  void expandsNestedGroups() {
    var parsed = parser.parse("K4[Fe(CN)6]");
    assertThat(parsed.getElements())
        .containsOnly(entry("K", 4), entry("Fe", 1), entry("C", 6), entry("N", 6));
  }

  @Test
  void mergesRepeatedElements() {
    var parsed = parser.parse("CH3COOH");
    assertThat(parsed.getElements()).containsOnly(entry("C", 2), entry("H", 4), entry("O", 2));
  }

  @Test
  void parsesHydrateWithMultiplier() {
    var parsed = parser.parse("CuSO4·5H2O");
    assertThat(parsed.getElements())
        .containsOnly(entry("Cu", 1), entry("S", 1), entry("O", 9), entry("H", 10));
  }

  private static Stream<Arguments> charges() {
    return Stream.of(
        Arguments.of("Fe^2+", "Fe", 2),
        Arguments.of("Fe^+3", "Fe", 3),
        Arguments.of("SO4^2-", "SO4", -2),
        Arguments.of("Fe+3", "Fe", 3),
        Arguments.of("NH4+", "NH4", 1),
        Arguments.of("Cl-", "Cl", -1),
        Arguments.of("Fe+++", "Fe", 3),
        Arguments.of("Ce⁴⁺", "Ce", 4),
        Arguments.of("Na⁺", "Na", 1),
        Arguments.of("Fe2+", "Fe2", 1)
    );
  }

  @ParameterizedTest
  @MethodSource("charges")
  void parsesCharge(String formula, String notation, int charge) {
    var parsed = parser.parse(formula);
    assertThat(parsed.getNotation()).isEqualTo(notation);
    assertThat(parsed.getCharge()).isEqualTo(charge);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "h2o", "Xx2", "Ca(OH", "H0", "+", "Ca(OH)2)"})
  void rejectsMalformedFormulas(String formula) {
    assertThatThrownBy(() -> parser.parse(formula)).isInstanceOf(ValidationException.class);
  }
}
