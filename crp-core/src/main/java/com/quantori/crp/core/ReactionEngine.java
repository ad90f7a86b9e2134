package com.quantori.crp.core;

import com.quantori.crp.api.element.ElementTable;
import com.quantori.crp.core.balance.NullSpaceBalancer;
import com.quantori.crp.core.balance.StoichiometricMatrixBuilder;
import com.quantori.crp.core.classify.ReactionTypeClassifier;
import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.fingerprint.ReactionFingerprinter;
import com.quantori.crp.core.group.FunctionalGroupAnalyzer;
import com.quantori.crp.core.io.EquationParser;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.oxidation.ElectronTransferAnalyzer;
import com.quantori.crp.core.oxidation.OxidationStateEstimator;
import com.quantori.crp.core.rule.DefaultReactionRules;
import com.quantori.crp.core.rule.ExpertRuleEngine;
import com.quantori.crp.core.thermo.ThermodynamicTable;
import com.quantori.crp.core.thermo.ThermodynamicsCalculator;
import lombok.Getter;

/**
 * Wires the balancing and classification components from one set of
 * {@link AnalysisConfigurationProperties}. An engine is immutable and can be shared by any number of
 * reactions.
 */
@Getter
public class ReactionEngine {

  private final AnalysisConfigurationProperties properties;
  private final ElementTable elementTable;
  private final NullSpaceBalancer balancer;
  private final OxidationStateEstimator oxidationStateEstimator;
  private final ElectronTransferAnalyzer electronTransferAnalyzer;
  private final FunctionalGroupAnalyzer functionalGroupAnalyzer;
  private final ExpertRuleEngine ruleEngine;
  private final ReactionFingerprinter fingerprinter;
  private final ReactionTypeClassifier classifier;
  private final ThermodynamicsCalculator thermodynamicsCalculator;

  public ReactionEngine(AnalysisConfigurationProperties properties) {
    this(properties, ElementTable.defaultTable());
  }

  public ReactionEngine(AnalysisConfigurationProperties properties, ElementTable elementTable) {
    this(properties, elementTable, new ExpertRuleEngine(DefaultReactionRules.create(properties)));
  }

  /**
   * Creates an engine with a custom rule set.
   *
   * @param properties   analysis settings
   * @param elementTable element properties used for oxidation states
   * @param ruleEngine   expert rules to evaluate during classification
   */
  public ReactionEngine(AnalysisConfigurationProperties properties, ElementTable elementTable,
                        ExpertRuleEngine ruleEngine) {
    this.properties = properties;
    this.elementTable = elementTable;
    this.balancer = new NullSpaceBalancer(properties, new StoichiometricMatrixBuilder());
    this.oxidationStateEstimator = new OxidationStateEstimator(properties, elementTable);
    this.electronTransferAnalyzer = new ElectronTransferAnalyzer(properties, oxidationStateEstimator);
    this.functionalGroupAnalyzer = new FunctionalGroupAnalyzer();
    this.ruleEngine = ruleEngine;
    this.fingerprinter = new ReactionFingerprinter(electronTransferAnalyzer);
    this.classifier = new ReactionTypeClassifier(properties, ruleEngine, electronTransferAnalyzer,
        functionalGroupAnalyzer, fingerprinter);
    this.thermodynamicsCalculator = new ThermodynamicsCalculator(ThermodynamicTable.defaultTable());
  }

  /**
   * Engine configured from the {@code reaction-analysis.conf} resource.
   *
   * @return shared default engine
   */
  public static ReactionEngine defaultEngine() {
    return DefaultHolder.INSTANCE;
  }

  public Reaction newReaction() {
    return new Reaction(this);
  }

  /**
   * Parses an equation such as {@code CH4 + 2O2 -> CO2 + 2H2O} into a reaction bound to this engine.
   *
   * @param equation equation text
   * @return parsed reaction
   * @throws com.quantori.crp.api.ValidationException if the equation is malformed
   */
  public Reaction parse(String equation) {
    return new EquationParser(this).parse(equation);
  }

  /**
   * Parses and balances an equation, e.g. {@code H2 + O2 -> H2O} gives {@code 2 H2 + O2 → 2 H2O}.
   *
   * @param equation equation text
   * @return rendering of the balanced reaction
   * @throws com.quantori.crp.core.balance.BalancingException if the reaction cannot be balanced
   */
  public String balanceEquation(String equation) {
    Reaction reaction = parse(equation);
    reaction.balance();
    return reaction.toString();
  }

  private static final class DefaultHolder {
    private static final ReactionEngine INSTANCE = new ReactionEngine(AnalysisConfigurationProperties.defaults());
  }
}
