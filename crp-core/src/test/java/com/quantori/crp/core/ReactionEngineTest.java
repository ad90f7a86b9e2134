package com.quantori.crp.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.crp.core.classify.ReactionType;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import org.junit.jupiter.api.Test;

class ReactionEngineTest {

  @Test
  void defaultEngineIsShared() {
    assertThat(ReactionEngine.defaultEngine()).isSameAs(ReactionEngine.defaultEngine());
    assertThat(new Reaction().getEngine()).isSameAs(ReactionEngine.defaultEngine());
  }

  @Test
  void parsesBalancesAndClassifies() {
    Reaction reaction = ReactionEngine.defaultEngine().parse("C3H8 + O2 -> CO2 + H2O");

    assertThat(reaction.isBalanced()).isFalse();
    assertThat(reaction.balance()).isTrue();

    assertThat(reaction.toString()).isEqualTo("C3H8 + 5 O2 → 3 CO2 + 4 H2O");
    assertThat(reaction.getClassification().getPrimaryType()).isEqualTo(ReactionType.COMBUSTION);
    assertThat(reaction.getType()).isEqualTo("combustion");
  }

  @Test
  void reactionsUseTheirOwnEngine() {
    AnalysisConfigurationProperties properties = AnalysisConfigurationProperties.defaults().toBuilder()
        .ruleConfidence(ReactionType.COMBUSTION, 0.5)
        .build();
    ReactionEngine engine = new ReactionEngine(properties);

    Reaction reaction = engine.parse("CH4 + 2O2 -> CO2 + 2H2O");

    assertThat(reaction.getEngine()).isSameAs(engine);
    assertThat(reaction.getClassification().getPrimaryType()).isEqualTo(ReactionType.REDOX);
    assertThat(reaction.getReactants()).extracting(ReactionComponent::getFormula).containsExactly("CH4", "O2");
  }
}
