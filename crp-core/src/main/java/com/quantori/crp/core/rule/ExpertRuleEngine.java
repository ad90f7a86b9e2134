package com.quantori.crp.core.rule;

import com.quantori.crp.core.model.Reaction;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates an ordered list of {@link ReactionRule}s independently of each other. A rule that throws
 * is reported as a {@link RuleFailure}; evaluation itself never throws.
 */
@Slf4j
public class ExpertRuleEngine {

  @Getter
  private final List<ReactionRule> rules;

  public ExpertRuleEngine(List<ReactionRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public RuleEvaluation evaluate(Reaction reaction) {
    List<RuleMatch> matches = new ArrayList<>();
    List<RuleFailure> failures = new ArrayList<>();
    for (ReactionRule rule : rules) {
      try {
        if (rule.getCondition().test(reaction)) {
          matches.add(new RuleMatch(rule.getName(), rule.getType(), rule.getConfidence()));
        }
      } catch (RuntimeException e) {
        log.debug("Rule {} failed on reaction {}", rule.getName(), reaction, e);
        failures.add(new RuleFailure(rule.getName(), rule.getType(), e));
      }
    }
    return new RuleEvaluation(List.copyOf(matches), List.copyOf(failures));
  }
}
