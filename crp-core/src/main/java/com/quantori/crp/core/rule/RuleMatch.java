package com.quantori.crp.core.rule;

import com.quantori.crp.core.classify.ReactionType;
import lombok.Value;

@Value
public class RuleMatch {
  String ruleName;
  ReactionType type;
  double confidence;
}
