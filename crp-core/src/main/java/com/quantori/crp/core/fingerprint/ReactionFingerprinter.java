package com.quantori.crp.core.fingerprint;

import com.quantori.crp.api.Phase;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import com.quantori.crp.core.oxidation.ElectronTransferAnalyzer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public class ReactionFingerprinter {

  private final ElectronTransferAnalyzer electronTransferAnalyzer;

  public ReactionFingerprinter(ElectronTransferAnalyzer electronTransferAnalyzer) {
    this.electronTransferAnalyzer = electronTransferAnalyzer;
  }

  public ReactionFingerprint fingerprint(Reaction reaction) {
    List<ReactionComponent> reactants = reaction.getReactants(false);
    List<ReactionComponent> products = reaction.getProducts();
    Map<String, Double> reactantElements = countElements(reactants);
    Map<String, Double> productElements = countElements(products);

    Map<String, Double> balance = new TreeMap<>();
    TreeSet<String> symbols = new TreeSet<>(reactantElements.keySet());
    symbols.addAll(productElements.keySet());
    symbols.forEach(symbol -> balance.put(symbol,
        productElements.getOrDefault(symbol, 0.0) - reactantElements.getOrDefault(symbol, 0.0)));

    return ReactionFingerprint.builder()
        .reactantElements(reactantElements)
        .productElements(productElements)
        .elementBalance(Collections.unmodifiableMap(balance))
        .phaseChanges(phaseChanges(reactants, products))
        .chargeTransfer(electronTransferAnalyzer.analyze(reaction).isRedox())
        .reactantCount(reactants.size())
        .productCount(products.size())
        .build();
  }

  private static Map<String, Double> countElements(List<ReactionComponent> components) {
    Map<String, Double> counts = new TreeMap<>();
    components.forEach(component -> component.getElements().keySet()
        .forEach(symbol -> counts.merge(symbol, component.atoms(symbol), Double::sum)));
    return Collections.unmodifiableMap(counts);
  }

  private static Map<String, PhaseChange> phaseChanges(List<ReactionComponent> reactants,
                                                       List<ReactionComponent> products) {
    Map<String, Phase> before = phasesByFormula(reactants);
    Map<String, Phase> after = phasesByFormula(products);
    Map<String, PhaseChange> changes = new LinkedHashMap<>();
    before.forEach((formula, phase) -> {
      Phase productPhase = after.get(formula);
      if (productPhase != null && productPhase != phase) {
        changes.put(formula, PhaseChange.of(phase, productPhase));
      }
    });
    return Collections.unmodifiableMap(changes);
  }

  private static Map<String, Phase> phasesByFormula(List<ReactionComponent> components) {
    Map<String, Phase> phases = new LinkedHashMap<>();
    components.stream()
        .filter(c -> c.getPhase().isKnown())
        .forEach(c -> phases.put(c.getFormula(), c.getPhase()));
    return phases;
  }
}
