package com.flamingo.ai.dealflow.service.reconcile;

import java.util.List;
import java.util.UUID;

/**
 * Result of scoring one financing event against the active deals.
 *
 * @param outcome what to do with the event
 * @param dealId deal to link, only for {@link Outcome#LINK}
 * @param confidence confidence of the best candidate
 * @param explanation signals that fired for the best candidate
 * @param candidates deals to offer a reviewer, best first
 */
public record ReconciliationDecision(
    Outcome outcome, UUID dealId, double confidence, String explanation, List<UUID> candidates) {

  public enum Outcome {
    LINK,
    LOW_CONFIDENCE,
    AMBIGUOUS,
    NO_MATCH
  }

  static ReconciliationDecision noMatch() {
    return new ReconciliationDecision(
        Outcome.NO_MATCH, null, 0.0, "No deal signals matched", List.of());
  }
}
