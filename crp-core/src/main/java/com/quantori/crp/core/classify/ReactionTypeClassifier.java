package com.quantori.crp.core.classify;

import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.fingerprint.ReactionFingerprinter;
import com.quantori.crp.core.group.FunctionalGroupAnalyzer;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.oxidation.ElectronTransfer;
import com.quantori.crp.core.oxidation.ElectronTransferAnalyzer;
import com.quantori.crp.core.rule.ExpertRuleEngine;
import com.quantori.crp.core.rule.RuleEvaluation;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges expert rule matches, electron transfer and a count-based fallback into confidence scores.
 * <ol>
 *   <li>every matched type starts at the highest confidence of its rules;</li>
 *   <li>on electron transfer, redox is raised to the configured redox confidence and synthesis and
 *   decomposition are multiplied by the structural penalty;</li>
 *   <li>the fallback type is raised to the baseline confidence;</li>
 *   <li>scores are clamped to [0, 1].</li>
 * </ol>
 * The primary type has the highest score; equal scores are resolved by the configured type priority.
 * Classification never throws: a failing stage is logged and contributes nothing.
 */
@Slf4j
public class ReactionTypeClassifier {

  private static final double TIE_EPSILON = 1e-9;

  private final AnalysisConfigurationProperties properties;
  private final ExpertRuleEngine ruleEngine;
  private final ElectronTransferAnalyzer electronTransferAnalyzer;
  private final FunctionalGroupAnalyzer functionalGroupAnalyzer;
  private final ReactionFingerprinter fingerprinter;
  private final CoarseTypeHeuristic coarseTypeHeuristic = new CoarseTypeHeuristic();

  public ReactionTypeClassifier(AnalysisConfigurationProperties properties, ExpertRuleEngine ruleEngine,
                                ElectronTransferAnalyzer electronTransferAnalyzer,
                                FunctionalGroupAnalyzer functionalGroupAnalyzer,
                                ReactionFingerprinter fingerprinter) {
    this.properties = properties;
    this.ruleEngine = ruleEngine;
    this.electronTransferAnalyzer = electronTransferAnalyzer;
    this.functionalGroupAnalyzer = functionalGroupAnalyzer;
    this.fingerprinter = fingerprinter;
  }

  /**
   * Scores every plausible type of a reaction.
   *
   * @param reaction reaction to classify
   * @return classification, {@link ReactionType#UNKNOWN} at 0 when nothing applies
   */
  public ClassificationResult classify(Reaction reaction) {
    RuleEvaluation evaluation = guarded("rule evaluation", reaction, () -> ruleEngine.evaluate(reaction));
    ElectronTransfer transfer = guarded("electron transfer", reaction, () -> electronTransferAnalyzer.analyze(reaction));
    return score(reaction, evaluation, transfer);
  }

  /**
   * Classification together with every intermediate analysis.
   *
   * @param reaction reaction to analyze
   * @return analysis report
   */
  public ReactionAnalysis analyze(Reaction reaction) {
    RuleEvaluation evaluation = guarded("rule evaluation", reaction, () -> ruleEngine.evaluate(reaction));
    ElectronTransfer transfer = guarded("electron transfer", reaction, () -> electronTransferAnalyzer.analyze(reaction));
    return ReactionAnalysis.builder()
        .classification(score(reaction, evaluation, transfer))
        .electronTransfer(transfer)
        .ruleEvaluation(evaluation)
        .functionalGroups(guarded("functional groups", reaction, () -> functionalGroupAnalyzer.analyze(reaction)))
        .fingerprint(guarded("fingerprint", reaction, () -> fingerprinter.fingerprint(reaction)))
        .build();
  }

  ClassificationResult score(Reaction reaction, RuleEvaluation evaluation, ElectronTransfer transfer) {
    Map<ReactionType, Double> scores = new EnumMap<>(ReactionType.class);
    if (evaluation != null) {
      scores.putAll(evaluation.maxConfidenceByType());
    }

    if (transfer != null && transfer.isRedox()) {
      scores.merge(ReactionType.REDOX, properties.getRedoxConfidence(), Math::max);
      scores.computeIfPresent(ReactionType.SYNTHESIS, (type, value) -> value * properties.getStructuralPenalty());
      scores.computeIfPresent(ReactionType.DECOMPOSITION, (type, value) -> value * properties.getStructuralPenalty());
    }

    ReactionType fallback = guarded("fallback heuristic", reaction, () -> coarseTypeHeuristic.classify(reaction));
    if (fallback != null && fallback != ReactionType.UNKNOWN) {
      scores.merge(fallback, properties.getBaselineConfidence(), Math::max);
    }

    scores.replaceAll((type, value) -> Math.max(0.0, Math.min(1.0, value)));
    if (scores.isEmpty()) {
      return new ClassificationResult(Map.of(ReactionType.UNKNOWN, 0.0), ReactionType.UNKNOWN);
    }
    double best = Collections.max(scores.values());
    ReactionType winner = scores.entrySet().stream()
        .filter(e -> best - e.getValue() < TIE_EPSILON)
        .map(Map.Entry::getKey)
        .min(priorityOrder())
        .orElse(ReactionType.UNKNOWN);
    log.debug("Classified {} as {} with scores {}", reaction, winner, scores);
    return new ClassificationResult(Collections.unmodifiableMap(scores), winner);
  }

  private Comparator<ReactionType> priorityOrder() {
    List<ReactionType> priority = properties.getTypePriority();
    return Comparator.comparingInt((ReactionType type) -> {
      int index = priority.indexOf(type);
      return index < 0 ? priority.size() + type.ordinal() : index;
    });
  }

  private static <T> T guarded(String stage, Reaction reaction, Supplier<T> computation) {
    try {
      return computation.get();
    } catch (RuntimeException e) {
      log.warn("Classification stage '{}' failed for reaction {}", stage, reaction, e);
      return null;
    }
  }
}
