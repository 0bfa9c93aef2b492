package com.flamingo.ai.dealflow.exception;

import java.util.UUID;

/** Exception thrown when resolving an alert that has already been resolved. */
public class AlertAlreadyResolvedException extends RuntimeException {

  private final UUID alertId;

  public AlertAlreadyResolvedException(UUID alertId) {
    super("Alert already resolved: " + alertId);
    this.alertId = alertId;
  }

  public UUID getAlertId() {
    return alertId;
  }
}
