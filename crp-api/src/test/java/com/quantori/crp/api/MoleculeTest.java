package com.quantori.crp.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.Test;

class MoleculeTest {

  @Test
  void rendersHillFormulaWithCarbon() {
    Molecule ethanol = Molecule.of("C2H5OH");
    assertThat(ethanol.getFormula()).isEqualTo("C2H6O");
    assertThat(ethanol.getNotation()).isEqualTo("C2H5OH");
    assertThat(ethanol.getElements().keySet()).containsExactly("C", "H", "O");
  }

  @Test
  void rendersHillFormulaWithoutCarbonAlphabetically() {
    assertThat(Molecule.of("NaOH").getFormula()).isEqualTo("HNaO");
    assertThat(Molecule.of("HCl").getFormula()).isEqualTo("ClH");
    assertThat(Molecule.of("CuSO4").getFormula()).isEqualTo("CuO4S");
  }

  @Test
  void computesMolecularWeight() {
    assertThat(Molecule.of("H2O").getMolecularWeight()).isCloseTo(18.015, within(1e-3));
    assertThat(Molecule.of("CO2").getMolecularWeight()).isCloseTo(44.009, within(1e-3));
  }

  @Test
  void comparesByComposition() {
    assertThat(Molecule.of("CH3COOH")).isEqualTo(Molecule.of("C2H4O2"));
    assertThat(Molecule.of("Fe^2+")).isNotEqualTo(Molecule.of("Fe^3+"));
    assertThat(Molecule.of("H2O", Phase.LIQUID)).isNotEqualTo(Molecule.of("H2O", Phase.GAS));
  }

  @Test
  void keepsChargeAndPhase() {
    Molecule ion = Molecule.of("Ce^4+", Phase.AQUEOUS);
    assertThat(ion.getCharge()).isEqualTo(4);
    assertThat(ion.isSingleElement()).isTrue();
    assertThat(ion.toString()).isEqualTo("Ce⁴⁺(aq)");
  }

  @Test
  void buildsFromElements() {
    Molecule methane = Molecule.fromElements(Map.of("H", 4, "C", 1), 0, null);
    assertThat(methane.getFormula()).isEqualTo("CH4");
    assertThat(methane.getPhase()).isEqualTo(Phase.NONE);
  }

  @Test
  void rejectsNonPositiveCountsAndUnknownElements() {
    assertThatThrownBy(() -> Molecule.fromElements(Map.of("H", 0), 0, null))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> Molecule.fromElements(Map.of("Qq", 1), 0, null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void resolvesPhases() {
    assertThat(Phase.of("aq")).isEqualTo(Phase.AQUEOUS);
    assertThat(Phase.of("Solid")).isEqualTo(Phase.SOLID);
    assertThat(Phase.of(null)).isEqualTo(Phase.NONE);
    assertThatThrownBy(() -> Phase.of("plasma")).isInstanceOf(ValidationException.class);
  }

  @Test
  void rendersChargeNotations() {
    assertThat(ChargeNotation.superscript("Fe", 2)).isEqualTo("Fe²⁺");
    assertThat(ChargeNotation.superscript("Cl", -1)).isEqualTo("Cl⁻");
    assertThat(ChargeNotation.caret("SO4", -2)).isEqualTo("SO4^2-");
    assertThat(ChargeNotation.caret("Na", 1)).isEqualTo("Na^+");
    assertThat(ChargeNotation.caret("H2O", 0)).isEqualTo("H2O");
  }
}
