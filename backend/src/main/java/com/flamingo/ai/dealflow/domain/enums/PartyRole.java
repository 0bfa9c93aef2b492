package com.flamingo.ai.dealflow.domain.enums;

/** Side of a transaction a party plays. */
public enum PartyRole {
  TARGET,
  ACQUIRER,
  ACQUISITION_VEHICLE,
  UNKNOWN
}
