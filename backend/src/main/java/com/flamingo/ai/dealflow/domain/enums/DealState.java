package com.flamingo.ai.dealflow.domain.enums;

/** Lifecycle state of a deal. */
public enum DealState {
  /** Created from the first unmatched fact cluster. */
  CANDIDATE,

  /** Both sides identified above the promotion threshold. */
  OPEN,

  /** Terminal; no further automatic attachment. */
  CLOSED,

  /** Terminal; manually frozen. */
  LOCKED,

  /** Conflict or ambiguity detected; requires human action to resume. */
  NEEDS_REVIEW;

  /** Whether the clustering service may attach facts to a deal in this state. */
  public boolean acceptsFacts() {
    return this == CANDIDATE || this == OPEN;
  }

  /** Whether this state is terminal. */
  public boolean isTerminal() {
    return this == CLOSED || this == LOCKED;
  }
}
