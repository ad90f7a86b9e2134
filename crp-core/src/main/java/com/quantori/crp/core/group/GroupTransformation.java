package com.quantori.crp.core.group;

import lombok.Value;

/**
 * A group that was consumed paired with a group that was formed.
 */
@Value(staticConstructor = "of")
public class GroupTransformation {
  FunctionalGroup from;
  FunctionalGroup to;

  @Override
  public String toString() {
    return from.code() + " -> " + to.code();
  }
}
