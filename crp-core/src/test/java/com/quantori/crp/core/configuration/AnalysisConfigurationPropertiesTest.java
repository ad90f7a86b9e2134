package com.quantori.crp.core.configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.crp.core.classify.ReactionType;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

class AnalysisConfigurationPropertiesTest {

  @Test
  void loadsBundledDefaults() {
    AnalysisConfigurationProperties properties = AnalysisConfigurationProperties.defaults();

    assertThat(properties.getBalanceTolerance()).isEqualTo(1e-6);
    assertThat(properties.getZeroClamp()).isEqualTo(1e-10);
    assertThat(properties.getOxidationChangeThreshold()).isEqualTo(0.1);
    assertThat(properties.getRedoxConfidence()).isEqualTo(0.95);
    assertThat(properties.getStructuralPenalty()).isEqualTo(0.5);
    assertThat(properties.getBaselineConfidence()).isEqualTo(0.8);
    assertThat(properties.getTypePriority()).startsWith(ReactionType.COMBUSTION, ReactionType.ACID_BASE)
        .doesNotContain(ReactionType.UNKNOWN);
    assertThat(properties.ruleConfidence(ReactionType.ISOMERIZATION)).isEqualTo(0.95);
    assertThat(properties.ruleConfidence(ReactionType.REDOX)).isZero();
    assertThat(properties.getHydrideMetals()).contains("Na", "Ca").doesNotContain("H");
    assertThat(properties.getPeroxidePartners()).contains("H", "Ba");
    assertThat(properties.getAcids()).contains("HCl", "CH3COOH");
    assertThat(properties.getBases()).contains("Ca(OH)2", "NH3");
  }

  @Test
  void overridesFromConfig() {
    Config config = ConfigFactory.parseString(
            "reaction-analysis.classification.type-priority = [redox, combustion]\n"
                + "reaction-analysis.rules.acid_base = 0.6")
        .withFallback(ConfigFactory.load("reaction-analysis"));

    AnalysisConfigurationProperties properties = AnalysisConfigurationProperties.fromConfig(config);

    assertThat(properties.getTypePriority()).containsExactly(ReactionType.REDOX, ReactionType.COMBUSTION);
    assertThat(properties.ruleConfidence(ReactionType.ACID_BASE)).isEqualTo(0.6);
    assertThat(properties.ruleConfidence(ReactionType.COMBUSTION)).isEqualTo(0.95);
  }

  @Test
  void rejectsUnknownTypeCodes() {
    Config config = ConfigFactory.parseString("reaction-analysis.rules.fusion = 0.5")
        .withFallback(ConfigFactory.load("reaction-analysis"));

    assertThatThrownBy(() -> AnalysisConfigurationProperties.fromConfig(config))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void failsOnMissingSection() {
    assertThatThrownBy(() -> AnalysisConfigurationProperties.fromConfig(ConfigFactory.empty()))
        .isInstanceOf(ConfigException.Missing.class);
  }
}
