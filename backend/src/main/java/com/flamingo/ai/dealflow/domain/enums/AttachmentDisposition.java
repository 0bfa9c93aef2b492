package com.flamingo.ai.dealflow.domain.enums;

/** Outcome recorded for a fact that has been processed by clustering or review. */
public enum AttachmentDisposition {
  ATTACHED,

  /** Set aside by a reviewer; the fact no longer counts as unattached. */
  DISMISSED
}
