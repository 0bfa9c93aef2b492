package com.flamingo.ai.dealflow.service.pipeline;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.PipelineBusyException;
import com.flamingo.ai.dealflow.service.attribution.AttributionService;
import com.flamingo.ai.dealflow.service.attribution.AttributionService.AttributionSummary;
import com.flamingo.ai.dealflow.service.classify.ClassificationService;
import com.flamingo.ai.dealflow.service.classify.ClassificationService.ClassificationSummary;
import com.flamingo.ai.dealflow.service.clustering.ClusteringSummary;
import com.flamingo.ai.dealflow.service.clustering.DealClusteringService;
import com.flamingo.ai.dealflow.service.document.DocumentOutcome;
import com.flamingo.ai.dealflow.service.document.DocumentProcessingService;
import com.flamingo.ai.dealflow.service.reconcile.ReconciliationService;
import com.flamingo.ai.dealflow.service.reconcile.ReconciliationSummary;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.annotation.Timed;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one full pass: extraction of pending documents in parallel, then clustering,
 * reconciliation, classification and attribution. Only one pass runs at a time.
 */
@Service
@Slf4j
public class PipelineService {

  static final String TIME_LIMITER = "documentExtraction";

  private final SourceDocumentRepository documentRepository;
  private final DocumentProcessingService processingService;
  private final DealClusteringService clusteringService;
  private final ReconciliationService reconciliationService;
  private final ClassificationService classificationService;
  private final AttributionService attributionService;
  private final AsyncTaskExecutor documentProcessingExecutor;
  private final TimeLimiterRegistry timeLimiterRegistry;
  private final ScheduledExecutorService timeoutScheduler =
      Executors.newSingleThreadScheduledExecutor();
  private final AtomicBoolean running = new AtomicBoolean(false);

  public PipelineService(
      SourceDocumentRepository documentRepository,
      DocumentProcessingService processingService,
      DealClusteringService clusteringService,
      ReconciliationService reconciliationService,
      ClassificationService classificationService,
      AttributionService attributionService,
      @Qualifier("documentProcessingExecutor") AsyncTaskExecutor documentProcessingExecutor,
      TimeLimiterRegistry timeLimiterRegistry) {
    this.documentRepository = documentRepository;
    this.processingService = processingService;
    this.clusteringService = clusteringService;
    this.reconciliationService = reconciliationService;
    this.classificationService = classificationService;
    this.attributionService = attributionService;
    this.documentProcessingExecutor = documentProcessingExecutor;
    this.timeLimiterRegistry = timeLimiterRegistry;
  }

  private record DocumentResult(UUID documentId, DocumentOutcome outcome, Throwable error) {}

  /**
   * Runs one pass over all pending documents and all stages.
   *
   * @return counts for every stage
   * @throws PipelineBusyException if a pass is already running
   */
  @Timed(value = "dealflow.pipeline", description = "Time to run a full pipeline pass")
  public PipelineRunSummary run() {
    if (!running.compareAndSet(false, true)) {
      throw new PipelineBusyException();
    }
    try {
      return runPass();
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  private PipelineRunSummary runPass() {
    Instant startedAt = Instant.now();
    List<UUID> pending =
        documentRepository
            .findByStatusInOrderByFiledOnAscReceivedAtAsc(
                EnumSet.of(DocumentStatus.PENDING, DocumentStatus.PROCESSING))
            .stream()
            .map(SourceDocument::getId)
            .toList();
    log.info("Pipeline pass started: {} documents to extract", pending.size());

    TimeLimiter limiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER);
    List<CompletableFuture<DocumentResult>> futures =
        pending.stream().map(id -> submit(id, limiter)).toList();

    int processed = 0;
    int failed = 0;
    int facts = 0;
    int alerts = 0;
    for (CompletableFuture<DocumentResult> future : futures) {
      DocumentResult result = future.join();
      if (result.error() == null) {
        DocumentOutcome outcome = result.outcome();
        facts += outcome.newFacts();
        alerts += outcome.alertsRaised();
        if (outcome.status() == DocumentStatus.FAILED) {
          failed++;
        } else {
          processed++;
        }
        continue;
      }
      failed++;
      handleFailure(result, limiter.getTimeLimiterConfig().getTimeoutDuration());
    }

    ClusteringSummary clustering = clusteringService.cluster();
    ReconciliationSummary reconciliation = reconciliationService.reconcile();
    ClassificationSummary classification = classificationService.classify();
    AttributionSummary attribution = attributionService.attribute();

    PipelineRunSummary summary =
        new PipelineRunSummary(
            processed,
            failed,
            facts,
            alerts,
            clustering,
            reconciliation,
            classification,
            attribution,
            startedAt,
            Instant.now());
    log.info(
        "Pipeline pass finished in {} ms: {} documents processed, {} failed, {} facts, {} alerts",
        Duration.between(startedAt, summary.finishedAt()).toMillis(),
        processed,
        failed,
        facts,
        alerts);
    return summary;
  }

  private CompletableFuture<DocumentResult> submit(UUID documentId, TimeLimiter limiter) {
    return limiter
        .executeCompletionStage(
            timeoutScheduler,
            () ->
                CompletableFuture.supplyAsync(
                    () -> processingService.process(documentId), documentProcessingExecutor))
        .toCompletableFuture()
        .handle((outcome, error) -> new DocumentResult(documentId, outcome, unwrap(error)));
  }

  private void handleFailure(DocumentResult result, Duration budget) {
    Throwable error = result.error();
    try {
      if (error instanceof TimeoutException) {
        processingService.markTimedOut(result.documentId(), budget);
      } else {
        log.error(
            "Processing of document {} failed: {}",
            result.documentId(),
            error.getMessage(),
            error);
        processingService.markFailed(result.documentId(), String.valueOf(error.getMessage()));
      }
    } catch (RuntimeException e) {
      log.error("Could not record failure of document {}", result.documentId(), e);
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  @PreDestroy
  void shutdown() {
    timeoutScheduler.shutdownNow();
  }
}
