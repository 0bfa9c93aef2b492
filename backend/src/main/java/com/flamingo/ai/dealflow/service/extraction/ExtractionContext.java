package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.service.normalize.NormalizedText;

/**
 * Input handed to every extraction rule.
 *
 * @param text normalized document text
 * @param kind document kind the rule set was selected for
 */
public record ExtractionContext(NormalizedText text, DocumentKind kind) {

  public String fullText() {
    return text.text();
  }

  /** The first {@code window} characters of the text. */
  public String window(int window) {
    return text.prefix(window);
  }
}
