package com.quantori.crp.core.oxidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.model.Reaction;
import org.junit.jupiter.api.Test;

class ElectronTransferAnalyzerTest {

  private final ReactionEngine engine = ReactionEngine.defaultEngine();
  private final ElectronTransferAnalyzer analyzer = engine.getElectronTransferAnalyzer();

  @Test
  void detectsRedoxBetweenElementalSubstances() {
    ElectronTransfer transfer = analyzer.analyze(engine.parse("H2 + F2 -> 2HF"));

    assertThat(transfer.isRedox()).isTrue();
    assertThat(transfer.getSource()).isEqualTo(ElectronTransfer.Source.OXIDATION_STATES);
    assertThat(transfer.getOxidizedElements()).containsExactly("H");
    assertThat(transfer.getReducedElements()).containsExactly("F");
    assertThat(transfer.getOxidizingAgent()).isEqualTo("F2");
    assertThat(transfer.getReducingAgent()).isEqualTo("H2");
  }

  @Test
  void detectsIonicRedoxAndAttributesAgents() {
    ElectronTransfer transfer = analyzer.analyze(engine.parse("Ce^4+ + Fe^2+ -> Fe^3+ + Ce^3+"));

    assertThat(transfer.isRedox()).isTrue();
    assertThat(transfer.getSource()).isEqualTo(ElectronTransfer.Source.IONIC_CHARGES);
    assertThat(transfer.getChanges().get("Ce")).isCloseTo(-1.0, within(1e-9));
    assertThat(transfer.getChanges().get("Fe")).isCloseTo(1.0, within(1e-9));
    assertThat(transfer.getOxidizingAgent()).isEqualTo("Ce⁴⁺");
    assertThat(transfer.getReducingAgent()).isEqualTo("Fe²⁺");
    assertThat(transfer.getAssignment()).isNull();
  }

  @Test
  void ionicPathIgnoresIonsOnlyPresentOnOneSide() {
    ElectronTransfer transfer = analyzer.analyzeIonicCharges(engine.parse("Ag^+ + Cl^- -> AgCl"));

    assertThat(transfer.isRedox()).isFalse();
    assertThat(transfer.getChanges()).isEmpty();
  }

  @Test
  void averagesOxidationStatesByCoefficientAndAtomCount() {
    OxidationStateAssignment assignment = analyzer.assign(engine.parse("2H2O2 -> 2H2O + O2"));

    assertThat(assignment.getReactantStates().get("O")).isCloseTo(-1.0, within(1e-9));
    assertThat(assignment.getProductStates().get("O")).isCloseTo(-1.0, within(1e-9));
    assertThat(assignment.change("H").getAsDouble()).isCloseTo(0.0, within(1e-9));
  }

  @Test
  void neutralizationIsNotRedox() {
    ElectronTransfer transfer = analyzer.analyze(engine.parse("HCl + NaOH -> NaCl + H2O"));

    assertThat(transfer.isRedox()).isFalse();
    assertThat(transfer.getOxidizingAgent()).isNull();
    assertThat(transfer.getReducingAgent()).isNull();
  }

  @Test
  void unresolvedElementsDoNotCountAsChanges() {
    ElectronTransfer transfer = analyzer.analyze(engine.parse("Zn + CuSO4 -> ZnSO4 + Cu"));

    assertThat(transfer.isRedox()).isFalse();
    assertThat(transfer.getAssignment().getProductStates()).doesNotContainKey("Zn");
    assertThat(transfer.getAssignment().change("Zn")).isEmpty();
  }

  @Test
  void combustionIsRedoxByOxidationStates() {
    ElectronTransfer transfer = analyzer.analyze(engine.parse("CH4 + 2O2 -> CO2 + 2H2O"));

    assertThat(transfer.isRedox()).isTrue();
    assertThat(transfer.getChanges()).containsOnlyKeys("C", "O");
    assertThat(transfer.getChanges().get("C")).isCloseTo(8.0, within(1e-9));
    assertThat(transfer.getReducingAgent()).isEqualTo("CH4");
    assertThat(transfer.getOxidizingAgent()).isEqualTo("O2");
  }
}
