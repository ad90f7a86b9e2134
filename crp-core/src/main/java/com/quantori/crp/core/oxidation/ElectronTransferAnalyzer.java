package com.quantori.crp.core.oxidation;

import com.quantori.crp.core.configuration.AnalysisConfigurationProperties;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects electron transfer between reaction sides.
 * <p>
 * Two paths are evaluated. The ionic path compares the per-atom charges of monatomic ions present on
 * both sides ({@code Fe²⁺ → Fe³⁺}); it relies on no heuristics, so whenever it finds redox character
 * its result wins. Otherwise the result comes from coefficient-weighted averages of estimated
 * oxidation numbers. In both paths a reaction is redox when at least two elements change.
 * Catalysts are ignored.
 */
@Slf4j
public class ElectronTransferAnalyzer {

  private static final int MIN_CHANGED_ELEMENTS = 2;

  private final AnalysisConfigurationProperties properties;
  private final OxidationStateEstimator estimator;

  public ElectronTransferAnalyzer(AnalysisConfigurationProperties properties, OxidationStateEstimator estimator) {
    this.properties = properties;
    this.estimator = estimator;
  }

  public ElectronTransfer analyze(Reaction reaction) {
    ElectronTransfer ionic = analyzeIonicCharges(reaction);
    if (ionic.isRedox()) {
      log.debug("Ionic charges indicate electron transfer in {}: {}", reaction, ionic.getChanges());
      return ionic;
    }
    return analyzeOxidationStates(reaction);
  }

  /**
   * Electron transfer from averaged oxidation numbers only.
   *
   * @param reaction reaction
   * @return result with {@link ElectronTransfer.Source#OXIDATION_STATES}
   */
  public ElectronTransfer analyzeOxidationStates(Reaction reaction) {
    OxidationStateAssignment assignment = assign(reaction);
    Map<String, Double> changes = assignment.changesAbove(properties.getOxidationChangeThreshold());
    return toResult(reaction, changes, ElectronTransfer.Source.OXIDATION_STATES, assignment,
        ReactionComponent::getElements);
  }

  /**
   * Electron transfer from the charges of monatomic ions only.
   *
   * @param reaction reaction
   * @return result with {@link ElectronTransfer.Source#IONIC_CHARGES}
   */
  public ElectronTransfer analyzeIonicCharges(Reaction reaction) {
    Map<String, Double> before = ionCharges(reaction.getReactants(false));
    Map<String, Double> after = ionCharges(reaction.getProducts());
    Map<String, Double> changes = new LinkedHashMap<>();
    before.forEach((symbol, charge) -> {
      Double productCharge = after.get(symbol);
      if (productCharge != null && Math.abs(productCharge - charge) > properties.getOxidationChangeThreshold()) {
        changes.put(symbol, productCharge - charge);
      }
    });
    return toResult(reaction, changes, ElectronTransfer.Source.IONIC_CHARGES, null,
        component -> isMonatomicIon(component) ? component.getElements() : Map.of());
  }

  /**
   * Coefficient-weighted average oxidation numbers per side.
   *
   * @param reaction reaction
   * @return per-side averages of the resolved elements
   */
  public OxidationStateAssignment assign(Reaction reaction) {
    return new OxidationStateAssignment(
        averageStates(reaction.getReactants(false)), averageStates(reaction.getProducts()));
  }

  private Map<String, Double> averageStates(List<ReactionComponent> components) {
    Map<String, Double> weightedSum = new LinkedHashMap<>();
    Map<String, Double> weight = new LinkedHashMap<>();
    for (ReactionComponent component : components) {
      Map<String, Double> states = estimator.estimate(component.getMolecule());
      states.forEach((symbol, state) -> {
        double atoms = component.atoms(symbol);
        weightedSum.merge(symbol, state * atoms, Double::sum);
        weight.merge(symbol, atoms, Double::sum);
      });
    }
    Map<String, Double> averages = new LinkedHashMap<>();
    weightedSum.forEach((symbol, sum) -> averages.put(symbol, sum / weight.get(symbol)));
    return averages;
  }

  private static Map<String, Double> ionCharges(List<ReactionComponent> components) {
    Map<String, Double> weightedSum = new LinkedHashMap<>();
    Map<String, Double> weight = new LinkedHashMap<>();
    for (ReactionComponent component : components) {
      if (!isMonatomicIon(component)) {
        continue;
      }
      Map.Entry<String, Integer> element = component.getElements().entrySet().iterator().next();
      double perAtom = (double) component.getMolecule().getCharge() / element.getValue();
      double atoms = component.getCoefficient() * element.getValue();
      weightedSum.merge(element.getKey(), perAtom * atoms, Double::sum);
      weight.merge(element.getKey(), atoms, Double::sum);
    }
    Map<String, Double> charges = new LinkedHashMap<>();
    weightedSum.forEach((symbol, sum) -> charges.put(symbol, sum / weight.get(symbol)));
    return charges;
  }

  private static boolean isMonatomicIon(ReactionComponent component) {
    return component.getMolecule().isSingleElement() && component.getMolecule().getCharge() != 0;
  }

  private ElectronTransfer toResult(Reaction reaction, Map<String, Double> changes, ElectronTransfer.Source source,
                                    OxidationStateAssignment assignment,
                                    Function<ReactionComponent, Map<String, Integer>> agentElements) {
    boolean redox = changes.size() >= MIN_CHANGED_ELEMENTS;
    ElectronTransfer.ElectronTransferBuilder result = ElectronTransfer.builder()
        .redox(redox)
        .source(source)
        .changes(changes)
        .assignment(assignment);
    if (redox) {
      ElectronTransfer draft = result.build();
      Set<String> oxidized = draft.getOxidizedElements();
      Set<String> reduced = draft.getReducedElements();
      String oxidizingAgent = null;
      String reducingAgent = null;
      for (ReactionComponent reactant : reaction.getReactants(false)) {
        Set<String> symbols = agentElements.apply(reactant).keySet();
        if (oxidizingAgent == null && symbols.stream().anyMatch(reduced::contains)) {
          oxidizingAgent = reactant.getLabel();
        }
        if (reducingAgent == null && symbols.stream().anyMatch(oxidized::contains)) {
          reducingAgent = reactant.getLabel();
        }
      }
      result.oxidizingAgent(oxidizingAgent).reducingAgent(reducingAgent);
    }
    return result.build();
  }
}
