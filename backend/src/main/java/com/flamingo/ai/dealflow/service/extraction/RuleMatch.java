package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.FactKind;
import java.util.Map;

/**
 * One result of an extraction rule: a payload anchored to a span of normalized text.
 *
 * @param kind fact kind to emit
 * @param payload kind-specific fields, see {@link
 *     com.flamingo.ai.dealflow.domain.entity.PayloadKeys}
 * @param start inclusive start offset in the normalized text
 * @param end exclusive end offset in the normalized text
 * @param confidence confidence in [0, 1]
 * @param ruleName name of the producing rule
 */
public record RuleMatch(
    FactKind kind,
    Map<String, String> payload,
    int start,
    int end,
    double confidence,
    String ruleName) {

  public RuleMatch {
    payload = Map.copyOf(payload);
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid evidence span [" + start + ", " + end + ")");
    }
  }
}
