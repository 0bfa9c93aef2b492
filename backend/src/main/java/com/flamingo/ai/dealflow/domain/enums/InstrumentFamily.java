package com.flamingo.ai.dealflow.domain.enums;

import java.util.Locale;

/** Instrument family of a financing event; keys the role splits of the rate table. */
public enum InstrumentFamily {
  BOND,
  LOAN,
  BRIDGE,
  UNKNOWN;

  /** Rate-table key for this family. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
