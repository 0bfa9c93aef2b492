package com.flamingo.ai.dealflow.domain.enums;

/** Market taxonomy applied to financing events and deals. */
public enum MarketTag {
  IG_BOND,
  HY_BOND,
  TERM_LOAN_B,
  OTHER_LOAN,
  BRIDGE,
  UNKNOWN
}
