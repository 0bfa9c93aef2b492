package com.flamingo.ai.dealflow.domain.enums;

/** Where an atomic fact came from. */
public enum FactProvenance {
  /** Produced by an extraction rule or the table interpreter. */
  AUTOMATIC,

  /** Entered by a human reviewer; never superseded by automatic extraction. */
  MANUAL
}
