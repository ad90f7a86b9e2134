package com.quantori.crp.core.fingerprint;

import com.quantori.crp.api.Phase;
import lombok.Value;

@Value(staticConstructor = "of")
public class PhaseChange {
  Phase from;
  Phase to;
}
