package com.flamingo.ai.dealflow.exception;

import java.util.UUID;

/** Exception thrown when a deal is not found. */
public class DealNotFoundException extends RuntimeException {

  private final UUID dealId;

  public DealNotFoundException(UUID dealId) {
    super("Deal not found: " + dealId);
    this.dealId = dealId;
  }

  public UUID getDealId() {
    return dealId;
  }
}
