package com.quantori.crp.core.classify;

import java.util.Arrays;
import java.util.Locale;

/**
 * Mechanistic reaction categories.
 */
public enum ReactionType {
  COMBUSTION,
  REDOX,
  ACID_BASE,
  PRECIPITATION,
  SINGLE_REPLACEMENT,
  DOUBLE_REPLACEMENT,
  SYNTHESIS,
  DECOMPOSITION,
  ISOMERIZATION,
  HYDROLYSIS,
  UNKNOWN;

  /**
   * Lower snake case name, e.g. {@code acid_base}.
   *
   * @return type code
   */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a type from its code, case-insensitive.
   *
   * @param code type code such as {@code single_replacement}
   * @return reaction type
   * @throws IllegalArgumentException if no type has this code
   */
  public static ReactionType fromCode(String code) {
    return Arrays.stream(values())
        .filter(t -> t.code().equalsIgnoreCase(code.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown reaction type: " + code));
  }
}
