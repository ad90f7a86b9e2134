package com.quantori.crp.core.rule;

import com.quantori.crp.api.Phase;
import com.quantori.crp.core.classify.ReactionType;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.List;
import java.util.function.Predicate;
import lombok.experimental.UtilityClass;

/**
 * The built-in expert rules. Catalysts never count as reactants here.
 */
@UtilityClass
public final class DefaultReactionRules {

  private static final String OXYGEN = "O2";
  private static final String CARBON_DIOXIDE = "CO2";
  private static final String WATER = "H2O";

  /**
   * Builds the default rule list with confidences and the acid/base catalog from configuration.
   *
   * @param properties analysis settings
   * @return ordered rules
   */
  public static List<ReactionRule> create(AnalysisConfigurationProperties properties) {
    AcidBaseCatalog catalog = new AcidBaseCatalog(properties.getAcids(), properties.getBases());
    return List.of(
        rule(properties, ReactionType.COMBUSTION, DefaultReactionRules::isCombustion),
        rule(properties, ReactionType.ACID_BASE, r -> isAcidBase(r, catalog)),
        rule(properties, ReactionType.PRECIPITATION, DefaultReactionRules::isPrecipitation),
        rule(properties, ReactionType.HYDROLYSIS, DefaultReactionRules::isHydrolysis),
        rule(properties, ReactionType.SINGLE_REPLACEMENT,
            r -> ReplacementPatterns.isSingleReplacement(r.getReactants(false), r.getProducts())),
        rule(properties, ReactionType.DOUBLE_REPLACEMENT,
            r -> ReplacementPatterns.isDoubleReplacement(r.getReactants(false), r.getProducts())),
        rule(properties, ReactionType.SYNTHESIS,
            r -> r.getReactants(false).size() > 1 && r.getProducts().size() == 1),
        rule(properties, ReactionType.DECOMPOSITION,
            r -> r.getReactants(false).size() == 1 && r.getProducts().size() > 1),
        rule(properties, ReactionType.ISOMERIZATION, DefaultReactionRules::isIsomerization));
  }

  static boolean isCombustion(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    return reactants.stream().anyMatch(r -> r.getMolecule().containsElement("C") && r.getMolecule().containsElement("H"))
        && reactants.stream().anyMatch(is(OXYGEN))
        && reaction.getProducts().stream().anyMatch(is(CARBON_DIOXIDE))
        && reaction.getProducts().stream().anyMatch(is(WATER));
  }

  static boolean isAcidBase(Reaction reaction, AcidBaseCatalog catalog) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    return reactants.stream().anyMatch(r -> catalog.isAcid(r.getMolecule()))
        && reactants.stream().anyMatch(r -> catalog.isBase(r.getMolecule()))
        && reaction.getProducts().stream().anyMatch(is(WATER));
  }

  static boolean isPrecipitation(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    return reactants.size() >= 2
        && reactants.stream().anyMatch(r -> r.getPhase() == Phase.AQUEOUS)
        && reaction.getProducts().stream().anyMatch(p -> p.getPhase() == Phase.SOLID);
  }

  static boolean isHydrolysis(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    return reactants.size() >= 2
        && reaction.getProducts().size() >= 2
        && reactants.stream().anyMatch(is(WATER))
        && reaction.getProducts().stream().noneMatch(is(WATER));
  }

  static boolean isIsomerization(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    List<ReactionComponent> products = reaction.getProducts();
    return reactants.size() == 1 && products.size() == 1
        && reactants.get(0).getFormula().equals(products.get(0).getFormula());
  }

  private static Predicate<ReactionComponent> is(String hillFormula) {
    return c -> c.getMolecule().getCharge() == 0 && hillFormula.equals(c.getFormula());
  }

  private static ReactionRule rule(AnalysisConfigurationProperties properties, ReactionType type,
                                   Predicate<Reaction> condition) {
    return ReactionRule.of(type, condition, properties.ruleConfidence(type));
  }
}
