package com.flamingo.ai.dealflow.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_002";
  public static final String DEAL_NOT_FOUND = "DEAL_001";
  public static final String INVALID_DEAL_STATE = "DEAL_002";
  public static final String ALERT_NOT_FOUND = "ALERT_001";
  public static final String ALERT_ALREADY_RESOLVED = "ALERT_002";
  public static final String PIPELINE_BUSY = "PIPELINE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
