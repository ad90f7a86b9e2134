package com.quantori.crp.core.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EquationParserTest {

  private final EquationParser parser = new EquationParser();

  @Test
  void parsesCoefficientsAndPhases() {
    Reaction reaction = parser.parse("Pb(NO3)2(aq) + 2KI(aq) -> PbI2(s) + 2 KNO3(aq)");

    assertThat(reaction.getReactants()).extracting(ReactionComponent::getFormula)
        .containsExactly("N2O6Pb", "IK");
    assertThat(reaction.getReactants()).extracting(ReactionComponent::getCoefficient).containsExactly(1.0, 2.0);
    assertThat(reaction.getReactants()).extracting(ReactionComponent::getPhase)
        .containsOnly(Phase.AQUEOUS);
    assertThat(reaction.getProducts().get(0).getPhase()).isEqualTo(Phase.SOLID);
    assertThat(reaction.getProducts().get(1).getCoefficient()).isEqualTo(2.0);
  }

  @ParameterizedTest
  @ValueSource(strings = {"H2 + Cl2 -> 2HCl", "H2 + Cl2 → 2HCl", "H2 + Cl2 = 2HCl", "H2+Cl2->2HCl"})
  void acceptsEveryArrow(String equation) {
    Reaction reaction = parser.parse(equation);

    assertThat(reaction.getReactants()).hasSize(2);
    assertThat(reaction.getProducts()).hasSize(1);
    assertThat(reaction.isBalanced()).isTrue();
  }

  @Test
  void keepsChargeSignsInsideTerms() {
    Reaction reaction = parser.parse("Na+ + Cl- -> NaCl");

    assertThat(reaction.getReactants()).extracting(c -> c.getMolecule().getCharge()).containsExactly(1, -1);
    assertThat(reaction.getReactants()).extracting(ReactionComponent::getLabel).containsExactly("Na⁺", "Cl⁻");
  }

  @Test
  void readsCaretAndSuperscriptCharges() {
    Reaction caret = parser.parse("Ce^4+ + Fe^2+ -> Fe^3+ + Ce^3+");
    Reaction superscript = parser.parse("Ce⁴⁺ + Fe²⁺ → Fe³⁺ + Ce³⁺");

    assertThat(caret.toString()).isEqualTo(superscript.toString());
    assertThat(caret.getReactants()).extracting(c -> c.getMolecule().getCharge()).containsExactly(4, 2);
  }

  @Test
  void splitsCompactIonicSides() {
    assertThat(EquationParser.splitTerms("Fe^2++Ce^4+")).containsExactly("Fe^2+", "Ce^4+");
    assertThat(EquationParser.splitTerms("H2+2O2")).containsExactly("H2", "2O2");
    assertThat(EquationParser.splitTerms(" ∅ ")).isEmpty();
  }

  @Test
  void readsCatalystsAndConditions() {
    Reaction reaction = parser.parse("2H2O2 -> 2H2O + O2 [catalyst: MnO2] [T=298K, P=1.5atm, solvent=water]");

    assertThat(reaction.getCatalysts()).extracting(ReactionComponent::getFormula).containsExactly("MnO2");
    assertThat(reaction.getReactants(false)).hasSize(1);
    assertThat(reaction.getTemperature()).isEqualTo(298.0);
    assertThat(reaction.getPressure()).isEqualTo(1.5);
    assertThat(reaction.getConditions()).containsExactly(entry("solvent", "water"));
  }

  @Test
  void parsesItsOwnRendering() {
    List<String> equations = List.of(
        "CH4 + 2O2 -> CO2 + 2H2O",
        "2H2O2 -> 2H2O(l) + O2(g) [catalyst: MnO2] [T=350K, medium=acidic]",
        "Ce^4+ + Fe^2+ -> Fe^3+ + Ce^3+",
        "0.5 N2 + 1.5H2 -> NH3",
        "-> O2");

    List<String> once = equations.stream().map(e -> parser.parse(e).toString()).collect(Collectors.toList());
    List<String> twice = once.stream().map(e -> parser.parse(e).toString()).collect(Collectors.toList());

    assertThat(twice).isEqualTo(once);
    assertThat(once.get(0)).isEqualTo("CH4 + 2 O2 → CO2 + 2 H2O");
    assertThat(once.get(4)).isEqualTo("∅ → O2");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "H2 + O2", "H2 -> H2O -> H2O2", "H2 + + O2 -> H2O", "H2 -> H2O [T=warm]",
      "H2 -> Xx2"})
  void rejectsMalformedEquations(String equation) {
    assertThatThrownBy(() -> parser.parse(equation)).isInstanceOf(ValidationException.class);
  }
}
