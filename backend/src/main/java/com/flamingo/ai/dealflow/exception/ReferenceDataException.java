package com.flamingo.ai.dealflow.exception;

/**
 * Thrown when a reference data file (rate table, sponsor seed list) is missing or malformed.
 * Raised during startup and never caught, so the application refuses to start.
 */
public class ReferenceDataException extends RuntimeException {

  private final String location;

  public ReferenceDataException(String location, String message) {
    super(message + " [" + location + "]");
    this.location = location;
  }

  public ReferenceDataException(String location, String message, Throwable cause) {
    super(message + " [" + location + "]", cause);
    this.location = location;
  }

  public String getLocation() {
    return location;
  }
}
