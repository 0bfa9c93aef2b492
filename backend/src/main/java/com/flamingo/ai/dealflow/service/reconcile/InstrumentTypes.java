package com.flamingo.ai.dealflow.service.reconcile;

import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import java.util.regex.Pattern;

/** Maps instrument wording to its family. */
public final class InstrumentTypes {

  private static final Pattern BRIDGE =
      Pattern.compile("\\bbridge\\b|\\binterim\\s+financing\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern BOND =
      Pattern.compile("\\b(?:notes?|bonds?|debentures?)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern LOAN =
      Pattern.compile(
          "\\b(?:loans?|credit\\s+facilit(?:y|ies)|facilit(?:y|ies)|revolv\\w*|tl[ab]?)\\b",
          Pattern.CASE_INSENSITIVE);

  private InstrumentTypes() {}

  /** Family of an instrument description; bridge wording wins over loan wording. */
  public static InstrumentFamily familyOf(String instrumentType) {
    if (instrumentType == null || instrumentType.isBlank()) {
      return InstrumentFamily.UNKNOWN;
    }
    if (BRIDGE.matcher(instrumentType).find()) {
      return InstrumentFamily.BRIDGE;
    }
    if (BOND.matcher(instrumentType).find()) {
      return InstrumentFamily.BOND;
    }
    if (LOAN.matcher(instrumentType).find()) {
      return InstrumentFamily.LOAN;
    }
    return InstrumentFamily.UNKNOWN;
  }
}
