package com.quantori.crp.core.configuration;

import com.quantori.crp.core.classify.ReactionType;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable settings of the balancing and classification engines. Defaults come from the
 * {@code reaction-analysis.conf} resource; tests can build alternate settings with the builder or
 * from any {@link Config}.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisConfigurationProperties {

  private static final String ROOT_PATH = "reaction-analysis";

  double balanceTolerance;
  double zeroClamp;

  double oxidationChangeThreshold;
  Set<String> hydrideMetals;
  Set<String> peroxidePartners;

  double redoxConfidence;
  double structuralPenalty;
  double baselineConfidence;
  List<ReactionType> typePriority;

  @Singular
  Map<ReactionType, Double> ruleConfidences;

  List<String> acids;
  List<String> bases;

  public static AnalysisConfigurationProperties defaults() {
    return DefaultHolder.INSTANCE;
  }

  /**
   * Reads the {@code reaction-analysis} section of a config.
   *
   * @param config configuration root
   * @return configuration properties
   */
  public static AnalysisConfigurationProperties fromConfig(Config config) {
    Config root = config.getConfig(ROOT_PATH);
    Config rules = root.getConfig("rules");
    Map<ReactionType, Double> ruleConfidences = new EnumMap<>(ReactionType.class);
    rules.root().keySet().forEach(key -> ruleConfidences.put(ReactionType.fromCode(key), rules.getDouble(key)));

    return AnalysisConfigurationProperties.builder()
        .balanceTolerance(root.getDouble("balancing.tolerance"))
        .zeroClamp(root.getDouble("balancing.zero-clamp"))
        .oxidationChangeThreshold(root.getDouble("oxidation.change-threshold"))
        .hydrideMetals(Set.copyOf(root.getStringList("oxidation.hydride-metals")))
        .peroxidePartners(Set.copyOf(root.getStringList("oxidation.peroxide-partners")))
        .redoxConfidence(root.getDouble("classification.redox-confidence"))
        .structuralPenalty(root.getDouble("classification.structural-penalty"))
        .baselineConfidence(root.getDouble("classification.baseline-confidence"))
        .typePriority(root.getStringList("classification.type-priority").stream()
            .map(ReactionType::fromCode)
            .collect(Collectors.toUnmodifiableList()))
        .ruleConfidences(ruleConfidences)
        .acids(List.copyOf(root.getStringList("catalog.acids")))
        .bases(List.copyOf(root.getStringList("catalog.bases")))
        .build();
  }

  /**
   * Confidence of the expert rule for a type, 0 when the rule is not configured.
   *
   * @param type reaction type
   * @return rule confidence
   */
  public double ruleConfidence(ReactionType type) {
    return ruleConfidences.getOrDefault(type, 0.0);
  }

  private static final class DefaultHolder {
    private static final AnalysisConfigurationProperties INSTANCE =
        fromConfig(ConfigFactory.load(ROOT_PATH));
  }
}
