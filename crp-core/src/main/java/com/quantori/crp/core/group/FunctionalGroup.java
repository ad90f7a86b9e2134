package com.quantori.crp.core.group;

import com.quantori.crp.api.MoleculeComposition;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Functional groups recognized by text patterns on the written formula. The patterns are coarse:
 * {@code NaOH} counts as an alcohol and {@code CO} as an aldehyde.
 */
public enum FunctionalGroup {
  ALCOHOL(m -> m.getNotation().contains("OH") && !m.getNotation().startsWith("HO")),
  ALDEHYDE(m -> m.getNotation().contains("CHO") || (m.getNotation().endsWith("O") && m.containsElement("C"))),
  KETONE(m -> m.getNotation().contains("CO") && !m.getNotation().contains("CHO") && !m.getNotation().contains("COOH")),
  CARBOXYLIC_ACID(m -> m.getNotation().contains("COOH")),
  ESTER(m -> m.getNotation().contains("COO") && !m.getNotation().contains("COOH")),
  AMINE(m -> m.getNotation().contains("NH2")),
  NITRILE(m -> m.getNotation().contains("CN")),
  NITRO(m -> m.getNotation().contains("NO2")),
  HALIDE(m -> m.getElements().keySet().stream().anyMatch(Halogens.SYMBOLS::contains));

  private final Predicate<MoleculeComposition> pattern;

  FunctionalGroup(Predicate<MoleculeComposition> pattern) {
    this.pattern = pattern;
  }

  public boolean isPresentIn(MoleculeComposition molecule) {
    return pattern.test(molecule);
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  private static final class Halogens {
    private static final Set<String> SYMBOLS = Set.of("F", "Cl", "Br", "I");
  }
}
