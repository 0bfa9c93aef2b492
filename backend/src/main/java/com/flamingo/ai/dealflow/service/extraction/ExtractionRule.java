package com.flamingo.ai.dealflow.service.extraction;

import java.util.List;

/**
 * A named pattern rule over normalized text.
 *
 * <p>Rules are pure: the same context always yields the same matches, and a rule never touches
 * persistent state. Rules are registered as Spring beans and dispatched per document kind by
 * {@link ExtractionRuleRegistry}.
 */
public interface ExtractionRule {

  /** Stable rule name, recorded as the extraction source of every fact the rule produces. */
  String name();

  /**
   * Applies the rule.
   *
   * @param context normalized text and document kind
   * @return matches in text order, possibly empty
   */
  List<RuleMatch> apply(ExtractionContext context);
}
