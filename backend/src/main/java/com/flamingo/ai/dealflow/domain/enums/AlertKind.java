package com.flamingo.ai.dealflow.domain.enums;

/** Kinds of processing alert raised for human review. */
public enum AlertKind {
  UNPARSED_MATERIAL_EXHIBIT,
  FAILED_PRIVATE_TARGET_EXTRACTION,
  LOW_CONFIDENCE_EXTRACTION,
  LOW_CONFIDENCE_MATCH,
  AMBIGUOUS_RECONCILIATION,
  DEAL_MERGE_CANDIDATE,
  CONFLICTING_DEAL_STATE,
  UNRESOLVED_SPONSOR,
  MALFORMED_TABLE,
  PROCESSING_TIMEOUT
}
