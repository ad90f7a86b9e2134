package com.quantori.crp.core.metrics;

import java.util.Map;
import lombok.Value;

/**
 * Heuristic rate law guess from molecularity, not a measured rate law.
 */
@Value
public class RateOrderEstimate {
  double overallOrder;
  /**
   * Order per reactant, keyed by Hill formula.
   */
  Map<String, Double> individualOrders;
}
