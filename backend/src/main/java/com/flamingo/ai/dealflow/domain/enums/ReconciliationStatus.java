package com.flamingo.ai.dealflow.domain.enums;

/** Reconciliation state of a financing event. */
public enum ReconciliationStatus {
  /** No deal matched yet; stays in the pool. */
  UNLINKED,

  LINKED,

  /** Candidate deals exist but none may be linked automatically. */
  PENDING_REVIEW
}
