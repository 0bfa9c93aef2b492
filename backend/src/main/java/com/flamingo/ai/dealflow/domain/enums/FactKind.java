package com.flamingo.ai.dealflow.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Closed set of atomic fact kinds. */
public enum FactKind {
  PARTY_MENTION,
  PARTY_DEFINITION,
  SPONSOR_MENTION,
  DEAL_DATE,
  CURRENCY_AMOUNT,
  FINANCING_MENTION,
  TABLE_ROLE,
  ADVISOR_MENTION,
  MANUAL_CORRECTION;

  private static final Set<FactKind> IDENTITY = EnumSet.of(PARTY_MENTION, PARTY_DEFINITION);

  private static final Set<FactKind> SECONDARY =
      EnumSet.of(SPONSOR_MENTION, DEAL_DATE, CURRENCY_AMOUNT, ADVISOR_MENTION);

  /** Facts that name a deal party and therefore drive clustering keys. */
  public boolean isIdentity() {
    return IDENTITY.contains(this);
  }

  /** Facts that attach to the deal of their document's identity facts. */
  public boolean isSecondary() {
    return SECONDARY.contains(this);
  }

  /** Kinds consumed by the clustering service; financing kinds go to the reconciler. */
  public static Set<FactKind> clusterable() {
    EnumSet<FactKind> kinds = EnumSet.copyOf(IDENTITY);
    kinds.addAll(SECONDARY);
    return kinds;
  }
}
