package com.quantori.crp.core.rule;

import com.quantori.crp.api.Molecule;
import com.quantori.crp.api.MoleculeComposition;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Known acids and bases, compared by element composition so that {@code CH3COOH} and {@code C2H4O2}
 * are the same entry. The bare proton {@code H⁺} counts as an acid and {@code OH⁻} as a base.
 */
public class AcidBaseCatalog {

  private static final Map<String, Integer> PROTON = Map.of("H", 1);
  private static final Map<String, Integer> HYDROXIDE = Map.of("O", 1, "H", 1);

  private final Set<Map<String, Integer>> acids;
  private final Set<Map<String, Integer>> bases;

  /**
   * Creates a catalog from formula strings.
   *
   * @param acids acid formulas
   * @param bases base formulas
   * @throws com.quantori.crp.api.ValidationException if a formula cannot be parsed
   */
  public AcidBaseCatalog(List<String> acids, List<String> bases) {
    this.acids = compositions(acids);
    this.bases = compositions(bases);
  }

  public boolean isAcid(MoleculeComposition molecule) {
    if (molecule.getCharge() == 1 && PROTON.equals(molecule.getElements())) {
      return true;
    }
    return molecule.getCharge() == 0 && acids.contains(molecule.getElements());
  }

  public boolean isBase(MoleculeComposition molecule) {
    if (molecule.getCharge() == -1 && HYDROXIDE.equals(molecule.getElements())) {
      return true;
    }
    return molecule.getCharge() == 0 && bases.contains(molecule.getElements());
  }

  private static Set<Map<String, Integer>> compositions(List<String> formulas) {
    return formulas.stream()
        .map(formula -> Map.copyOf(Molecule.of(formula).getElements()))
        .collect(Collectors.toUnmodifiableSet());
  }
}
