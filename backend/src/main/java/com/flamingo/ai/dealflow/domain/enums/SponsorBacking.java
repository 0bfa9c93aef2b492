package com.flamingo.ai.dealflow.domain.enums;

/** Sponsor-backed tag of a deal: true, false or unknown. */
public enum SponsorBacking {
  SPONSOR_BACKED,
  STRATEGIC,
  UNKNOWN
}
