package com.quantori.crp.core.group;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Named mechanisms derived from functional group transformations. Mechanisms needing two
 * transformations are listed before the single-transformation ones and are matched first.
 */
public enum OrganicMechanism {
  ESTERIFICATION(List.of(
      Set.of(GroupTransformation.of(FunctionalGroup.ALCOHOL, FunctionalGroup.ESTER)),
      Set.of(GroupTransformation.of(FunctionalGroup.CARBOXYLIC_ACID, FunctionalGroup.ESTER)))),
  HYDROLYSIS(List.of(
      Set.of(GroupTransformation.of(FunctionalGroup.ESTER, FunctionalGroup.ALCOHOL)),
      Set.of(GroupTransformation.of(FunctionalGroup.ESTER, FunctionalGroup.CARBOXYLIC_ACID)))),
  OXIDATION(List.of(Set.of(
      GroupTransformation.of(FunctionalGroup.ALCOHOL, FunctionalGroup.KETONE),
      GroupTransformation.of(FunctionalGroup.ALCOHOL, FunctionalGroup.ALDEHYDE)))),
  REDUCTION(List.of(Set.of(
      GroupTransformation.of(FunctionalGroup.KETONE, FunctionalGroup.ALCOHOL),
      GroupTransformation.of(FunctionalGroup.ALDEHYDE, FunctionalGroup.ALCOHOL)))),
  NUCLEOPHILIC_SUBSTITUTION(List.of(Set.of(
      GroupTransformation.of(FunctionalGroup.HALIDE, FunctionalGroup.ALCOHOL)))),
  UNKNOWN(List.of());

  /**
   * Every entry must be satisfied by at least one of its alternatives.
   */
  private final List<Set<GroupTransformation>> requirements;

  OrganicMechanism(List<Set<GroupTransformation>> requirements) {
    this.requirements = requirements;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * First mechanism whose requirements are all met by the observed transformations.
   *
   * @param transformations observed transformations
   * @return matching mechanism, {@link #UNKNOWN} when none matches
   */
  public static OrganicMechanism of(Set<GroupTransformation> transformations) {
    for (OrganicMechanism mechanism : values()) {
      if (mechanism != UNKNOWN && mechanism.requirements.stream()
          .allMatch(alternatives -> alternatives.stream().anyMatch(transformations::contains))) {
        return mechanism;
      }
    }
    return UNKNOWN;
  }
}
