package com.flamingo.ai.dealflow.service.pipeline;

import com.flamingo.ai.dealflow.service.attribution.AttributionService.AttributionSummary;
import com.flamingo.ai.dealflow.service.classify.ClassificationService.ClassificationSummary;
import com.flamingo.ai.dealflow.service.clustering.ClusteringSummary;
import com.flamingo.ai.dealflow.service.reconcile.ReconciliationSummary;
import java.time.Instant;

/**
 * Result of one full pipeline pass.
 *
 * @param documentsProcessed documents whose extraction completed
 * @param documentsFailed documents that failed or timed out
 * @param factsStored facts stored by this pass
 * @param alertsRaised extraction alerts raised by this pass
 * @param clustering clustering counts
 * @param reconciliation reconciliation counts
 * @param classification classification counts
 * @param attribution attribution counts and totals
 * @param startedAt when the pass started
 * @param finishedAt when the pass finished
 */
public record PipelineRunSummary(
    int documentsProcessed,
    int documentsFailed,
    int factsStored,
    int alertsRaised,
    ClusteringSummary clustering,
    ReconciliationSummary reconciliation,
    ClassificationSummary classification,
    AttributionSummary attribution,
    Instant startedAt,
    Instant finishedAt) {}
