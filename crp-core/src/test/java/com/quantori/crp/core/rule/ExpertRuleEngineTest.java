package com.quantori.crp.core.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.classify.ReactionType;
import com.quantori.crp.core.model.Reaction;
import java.util.List;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExpertRuleEngineTest {

  @Mock
  private Predicate<Reaction> failingCondition;

  @Mock
  private Predicate<Reaction> matchingCondition;

  private final Reaction reaction = ReactionEngine.defaultEngine().parse("H2 + Cl2 -> 2HCl");

  @Test
  void recordsFailingRuleAndKeepsEvaluating() {
    when(failingCondition.test(any())).thenThrow(new IllegalStateException("broken rule"));
    when(matchingCondition.test(any())).thenReturn(true);
    ExpertRuleEngine engine = new ExpertRuleEngine(List.of(
        ReactionRule.of(ReactionType.PRECIPITATION, failingCondition, 0.85),
        ReactionRule.of(ReactionType.SYNTHESIS, matchingCondition, 0.9)));

    RuleEvaluation evaluation = engine.evaluate(reaction);

    assertThat(evaluation.getMatches())
        .containsExactly(new RuleMatch("synthesis", ReactionType.SYNTHESIS, 0.9));
    assertThat(evaluation.getFailures()).hasSize(1);
    RuleFailure failure = evaluation.getFailures().get(0);
    assertThat(failure.getRuleName()).isEqualTo("precipitation");
    assertThat(failure.getType()).isEqualTo(ReactionType.PRECIPITATION);
    assertThat(failure.getMessage()).isEqualTo("IllegalStateException: broken rule");
    verify(matchingCondition).test(reaction);
  }

  @Test
  void keepsHighestConfidencePerType() {
    ExpertRuleEngine engine = new ExpertRuleEngine(List.of(
        new ReactionRule("weak redox", ReactionType.REDOX, r -> true, 0.4),
        new ReactionRule("strong redox", ReactionType.REDOX, r -> true, 0.7),
        new ReactionRule("never", ReactionType.COMBUSTION, r -> false, 0.95)));

    RuleEvaluation evaluation = engine.evaluate(reaction);

    assertThat(evaluation.getMatches()).hasSize(2);
    assertThat(evaluation.hasFailures()).isFalse();
    assertThat(evaluation.maxConfidenceByType()).containsOnlyKeys(ReactionType.REDOX);
    assertThat(evaluation.maxConfidenceByType().get(ReactionType.REDOX)).isEqualTo(0.7);
  }

  @Test
  void emptyEvaluationHasNoMatches() {
    RuleEvaluation evaluation = new ExpertRuleEngine(List.of()).evaluate(reaction);

    assertThat(evaluation.hasMatches()).isFalse();
    assertThat(evaluation).isEqualTo(RuleEvaluation.empty());
  }
}
