package com.flamingo.ai.dealflow.service.alert;

import com.flamingo.ai.dealflow.service.fact.ManualFactInput;
import java.util.List;

/**
 * A reviewer's resolution of an alert.
 *
 * @param resolvedBy reviewer identity
 * @param notes free-text notes
 * @param facts manual facts entered as part of the resolution; may be empty
 */
public record AlertResolution(String resolvedBy, String notes, List<ManualFactInput> facts) {

  public AlertResolution {
    facts = facts == null ? List.of() : List.copyOf(facts);
  }
}
