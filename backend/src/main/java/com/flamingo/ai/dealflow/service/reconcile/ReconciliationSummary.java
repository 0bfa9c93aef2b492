package com.flamingo.ai.dealflow.service.reconcile;

/** Counts for one reconciliation pass. */
public record ReconciliationSummary(
    int eventsAssembled,
    int participantsAdded,
    int eventsScanned,
    int manualLinks,
    int linked,
    int pendingReview,
    int unlinked,
    int retried) {}
