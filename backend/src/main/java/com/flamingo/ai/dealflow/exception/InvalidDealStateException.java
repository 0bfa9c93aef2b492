package com.flamingo.ai.dealflow.exception;

import com.flamingo.ai.dealflow.domain.enums.DealState;
import java.util.UUID;

/** Exception thrown when a lifecycle operation is not allowed in the deal's current state. */
public class InvalidDealStateException extends RuntimeException {

  private final UUID dealId;
  private final DealState state;

  public InvalidDealStateException(UUID dealId, DealState state, String operation) {
    super("Cannot " + operation + " deal " + dealId + " in state " + state);
    this.dealId = dealId;
    this.state = state;
  }

  public UUID getDealId() {
    return dealId;
  }

  public DealState getState() {
    return state;
  }

  public String getUserMessage() {
    return "Operation not allowed while the deal is " + state;
  }
}
