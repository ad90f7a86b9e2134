package com.quantori.crp.core.group;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Coefficient-weighted functional group counts of both sides and what they suggest.
 */
@Value
public class FunctionalGroupAnalysis {
  Map<FunctionalGroup, Double> reactantGroups;
  Map<FunctionalGroup, Double> productGroups;
  List<GroupTransformation> transformations;
  OrganicMechanism mechanism;
}
