package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import java.util.UUID;

/**
 * Result of processing one document.
 *
 * @param documentId the document
 * @param status status after processing
 * @param newFacts facts stored by this run
 * @param alertsRaised alerts newly raised by this run
 */
public record DocumentOutcome(
    UUID documentId, DocumentStatus status, int newFacts, int alertsRaised) {}
