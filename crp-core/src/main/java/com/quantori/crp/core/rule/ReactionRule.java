package com.quantori.crp.core.rule;

import com.quantori.crp.core.classify.ReactionType;
import com.quantori.crp.core.model.Reaction;
import java.util.function.Predicate;
import lombok.NonNull;
import lombok.Value;

/**
 * A named expert rule: when {@code condition} holds, the reaction is of {@code type} with the given
 * confidence.
 */
@Value
public class ReactionRule {
  @NonNull
  String name;
  @NonNull
  ReactionType type;
  @NonNull
  Predicate<Reaction> condition;
  double confidence;

  public static ReactionRule of(ReactionType type, Predicate<Reaction> condition, double confidence) {
    return new ReactionRule(type.code(), type, condition, confidence);
  }
}
