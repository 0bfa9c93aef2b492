package com.flamingo.ai.dealflow.domain.enums;

/** Defines the processing status of a submitted filing document. */
public enum DocumentStatus {
  /** Document has been submitted but not yet normalized or extracted. */
  PENDING,

  /** Document is currently being normalized and extracted. */
  PROCESSING,

  /** Facts have been extracted from the document. */
  EXTRACTED,

  /** Document processing failed or timed out. */
  FAILED
}
