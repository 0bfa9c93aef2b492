package com.flamingo.ai.dealflow.service.fact;

import com.flamingo.ai.dealflow.domain.enums.FactKind;
import java.util.Map;
import java.util.UUID;

/**
 * A fact typed in by a reviewer.
 *
 * @param kind fact kind
 * @param payload kind-specific fields, using the same keys as automatic facts
 * @param targetDealId deal the fact is aimed at, or null to cluster it like any other fact
 * @param note free-text justification
 */
public record ManualFactInput(
    FactKind kind, Map<String, String> payload, UUID targetDealId, String note) {

  public ManualFactInput {
    payload = payload == null ? Map.of() : Map.copyOf(payload);
  }
}
