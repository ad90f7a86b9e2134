package com.quantori.crp.core.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.quantori.crp.api.Phase;
import com.quantori.crp.core.ReactionEngine;
import org.junit.jupiter.api.Test;

class ReactionFingerprinterTest {

  private final ReactionEngine engine = ReactionEngine.defaultEngine();
  private final ReactionFingerprinter fingerprinter = engine.getFingerprinter();

  @Test
  void countsWeightedElementsPerSide() {
    ReactionFingerprint fingerprint = fingerprinter.fingerprint(engine.parse("CH4 + 2O2 -> CO2 + 2H2O"));

    assertThat(fingerprint.getReactantElements()).containsExactly(entry("C", 1.0), entry("H", 4.0), entry("O", 4.0));
    assertThat(fingerprint.getProductElements()).containsExactly(entry("C", 1.0), entry("H", 4.0), entry("O", 4.0));
    assertThat(fingerprint.getElementBalance()).containsOnly(entry("C", 0.0), entry("H", 0.0), entry("O", 0.0));
    assertThat(fingerprint.isChargeTransfer()).isTrue();
    assertThat(fingerprint.getReactantCount()).isEqualTo(2);
    assertThat(fingerprint.getProductCount()).isEqualTo(2);
  }

  @Test
  void reportsImbalanceAsProductsMinusReactants() {
    ReactionFingerprint fingerprint = fingerprinter.fingerprint(engine.parse("H2 + O2 -> H2O"));

    assertThat(fingerprint.getElementBalance()).containsOnly(entry("H", 0.0), entry("O", -1.0));
    assertThat(fingerprint.hasPhaseChanges()).isFalse();
  }

  @Test
  void detectsPhaseChangesOfTheSameSubstance() {
    ReactionFingerprint fingerprint = fingerprinter.fingerprint(engine.parse("H2O(s) -> H2O(l)"));

    assertThat(fingerprint.hasPhaseChanges()).isTrue();
    assertThat(fingerprint.getPhaseChanges()).containsExactly(entry("H2O", PhaseChange.of(Phase.SOLID, Phase.LIQUID)));
    assertThat(fingerprint.isChargeTransfer()).isFalse();
  }

  @Test
  void ignoresUnknownPhasesAndCatalysts() {
    ReactionFingerprint fingerprint = fingerprinter.fingerprint(
        engine.parse("2H2O2 -> 2H2O(l) + O2(g) [catalyst: MnO2]"));

    assertThat(fingerprint.hasPhaseChanges()).isFalse();
    assertThat(fingerprint.getReactantElements()).doesNotContainKey("Mn");
    assertThat(fingerprint.getReactantCount()).isEqualTo(1);
  }
}
