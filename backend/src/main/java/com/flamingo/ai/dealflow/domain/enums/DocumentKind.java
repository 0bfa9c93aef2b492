package com.flamingo.ai.dealflow.domain.enums;

import java.util.Locale;

/** Kind of filing document; selects the extraction rule set applied to it. */
public enum DocumentKind {
  /** Form 8-K current report. */
  CURRENT_REPORT,

  /** Exhibit 2.x, typically an agreement and plan of merger. */
  MERGER_AGREEMENT,

  /** Exhibit 10.x, material contracts such as credit agreements and commitment letters. */
  MATERIAL_CONTRACT,

  /** Exhibit 99.x, press releases. */
  PRESS_RELEASE,

  OTHER;

  /**
   * Maps a registry form or exhibit type (e.g. {@code 8-K}, {@code EX-2.1}, {@code EX-99.1}) to a
   * document kind.
   */
  public static DocumentKind fromFormType(String formType) {
    if (formType == null || formType.isBlank()) {
      return OTHER;
    }
    String type = formType.trim().toUpperCase(Locale.ROOT);
    if (type.startsWith("8-K")) {
      return CURRENT_REPORT;
    }
    if (type.startsWith("EX-2")) {
      return MERGER_AGREEMENT;
    }
    if (type.startsWith("EX-10")) {
      return MATERIAL_CONTRACT;
    }
    if (type.startsWith("EX-99")) {
      return PRESS_RELEASE;
    }
    return OTHER;
  }
}
