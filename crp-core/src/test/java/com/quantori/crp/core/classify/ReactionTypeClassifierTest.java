package com.quantori.crp.core.classify;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.quantori.crp.api.element.ElementTable;
import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.rule.ExpertRuleEngine;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ReactionTypeClassifierTest {

  private final ReactionEngine engine = ReactionEngine.defaultEngine();

  private static Stream<Arguments> scenarios() {
    return Stream.of(
        Arguments.of("CH4 + 2O2 -> CO2 + 2H2O", ReactionType.COMBUSTION),
        Arguments.of("H2 + F2 -> 2HF", ReactionType.REDOX),
        Arguments.of("Zn + CuSO4 -> ZnSO4 + Cu", ReactionType.SINGLE_REPLACEMENT),
        Arguments.of("HCl + NaOH -> NaCl + H2O", ReactionType.ACID_BASE),
        Arguments.of("2H2O2 -> 2H2O + O2", ReactionType.DECOMPOSITION),
        Arguments.of("Ce^4+ + Fe^2+ -> Fe^3+ + Ce^3+", ReactionType.REDOX),
        Arguments.of("N2 + 3H2 -> 2NH3", ReactionType.REDOX),
        Arguments.of("AgNO3 + NaCl -> AgCl + NaNO3", ReactionType.DOUBLE_REPLACEMENT),
        Arguments.of("Pb(NO3)2(aq) + 2KI(aq) -> PbI2(s) + 2KNO3(aq)", ReactionType.PRECIPITATION),
        Arguments.of("CH3COOCH3 + H2O -> CH3COOH + CH3OH", ReactionType.HYDROLYSIS),
        Arguments.of("CaCO3 -> CaO + CO2", ReactionType.DECOMPOSITION),
        Arguments.of("CaO + CO2 -> CaCO3", ReactionType.SYNTHESIS),
        Arguments.of("CH3CH2OH -> CH3OCH3", ReactionType.ISOMERIZATION),
        Arguments.of("H2O -> H2O2", ReactionType.UNKNOWN)
    );
  }

  @ParameterizedTest
  @MethodSource("scenarios")
  void classifiesReaction(String equation, ReactionType expected) {
    ClassificationResult result = engine.getClassifier().classify(engine.parse(equation));

    assertThat(result.getPrimaryType(), is(expected));
    assertThat(result.getConfidenceScores().values(),
        everyItem(allOf(greaterThanOrEqualTo(0.0), lessThanOrEqualTo(1.0))));
    assertThat(result.getPrimaryConfidence(), is(Collections.max(result.getConfidenceScores().values())));
  }

  @Test
  void redoxHalvesStructuralScoresBeforeBaseline() {
    ClassificationResult result = engine.getClassifier().classify(engine.parse("H2 + F2 -> 2HF"));

    assertThat(result.getConfidenceScores(), hasEntry(ReactionType.REDOX, 0.95));
    assertThat(result.confidence(ReactionType.SYNTHESIS), closeTo(0.8, 1e-9));
  }

  @Test
  void tiesResolveByConfiguredPriority() {
    ClassificationResult byDefault = engine.getClassifier().classify(engine.parse("CH4 + 2O2 -> CO2 + 2H2O"));
    assertThat(byDefault.confidence(ReactionType.COMBUSTION), is(byDefault.confidence(ReactionType.REDOX)));

    AnalysisConfigurationProperties redoxFirst = AnalysisConfigurationProperties.defaults().toBuilder()
        .typePriority(List.of(ReactionType.REDOX, ReactionType.COMBUSTION))
        .build();
    ReactionEngine redoxFirstEngine = new ReactionEngine(redoxFirst);

    ClassificationResult result = redoxFirstEngine.getClassifier()
        .classify(redoxFirstEngine.parse("CH4 + 2O2 -> CO2 + 2H2O"));

    assertThat(result.getPrimaryType(), is(ReactionType.REDOX));
  }

  @Test
  void emptyReactionIsUnknownAtZero() {
    ClassificationResult result = engine.getClassifier().classify(engine.newReaction());

    assertThat(result.getPrimaryType(), is(ReactionType.UNKNOWN));
    assertThat(result.getConfidenceScores(), hasEntry(ReactionType.UNKNOWN, 0.0));
  }

  @Test
  void failingRuleEngineDoesNotBreakClassification() {
    ExpertRuleEngine ruleEngine = mock(ExpertRuleEngine.class);
    when(ruleEngine.evaluate(any(Reaction.class))).thenThrow(new IllegalStateException("rules unavailable"));
    ReactionEngine failing = new ReactionEngine(AnalysisConfigurationProperties.defaults(),
        ElementTable.defaultTable(), ruleEngine);

    Reaction reaction = failing.parse("H2 + F2 -> 2HF");
    ReactionAnalysis analysis = failing.getClassifier().analyze(reaction);

    assertThat(analysis.getRuleEvaluation(), is(nullValue()));
    assertThat(analysis.getPrimaryType(), is(ReactionType.REDOX));
    assertThat(analysis.getClassification().confidence(ReactionType.SYNTHESIS), closeTo(0.8, 1e-9));
    assertThat(reaction.getType(), is("redox"));
  }

  @Test
  void analysisCarriesEveryPart() {
    ReactionAnalysis analysis = engine.parse("CH3COOCH3 + H2O -> CH3COOH + CH3OH").analyze();

    assertThat(analysis.getClassification(), is(notNullValue()));
    assertThat(analysis.getElectronTransfer().isRedox(), is(false));
    assertThat(analysis.getRuleEvaluation().hasMatches(), is(true));
    assertThat(analysis.getFunctionalGroups().getMechanism().code(), is("hydrolysis"));
    assertThat(analysis.getFingerprint().getReactantCount(), is(2));
  }

  @Test
  void reactionTypeCodes() {
    assertThat(ReactionType.ACID_BASE.code(), is("acid_base"));
    assertThat(ReactionType.fromCode("Single_Replacement"), is(ReactionType.SINGLE_REPLACEMENT));
  }
}
