package com.flamingo.ai.dealflow.exception;

import java.util.UUID;

/** Exception thrown when a processing alert is not found. */
public class AlertNotFoundException extends RuntimeException {

  private final UUID alertId;

  public AlertNotFoundException(UUID alertId) {
    super("Alert not found: " + alertId);
    this.alertId = alertId;
  }

  public UUID getAlertId() {
    return alertId;
  }
}
