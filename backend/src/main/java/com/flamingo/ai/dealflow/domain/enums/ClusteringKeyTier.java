package com.flamingo.ai.dealflow.domain.enums;

/** Priority tier of a deal clustering key, best first. */
public enum ClusteringKeyTier {
  /** Acquirer identifier and target identifier. */
  IDENTIFIERS,

  /** Acquirer identifier and normalized target name. */
  ACQUIRER_IDENTIFIER,

  /** Normalized names only; requires review. */
  NAMES
}
