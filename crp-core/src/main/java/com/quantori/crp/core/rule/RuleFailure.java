package com.quantori.crp.core.rule;

import com.quantori.crp.core.classify.ReactionType;
import lombok.Value;

/**
 * A rule whose condition threw instead of answering. The rule counts as not matching.
 */
@Value
public class RuleFailure {
  String ruleName;
  ReactionType type;
  RuntimeException cause;

  public String getMessage() {
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
