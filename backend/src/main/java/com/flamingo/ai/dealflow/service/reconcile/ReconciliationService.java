package com.flamingo.ai.dealflow.service.reconcile;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.ReconciliationStatus;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingParticipantRepository;
import com.flamingo.ai.dealflow.service.alert.AlertService;
import com.flamingo.ai.dealflow.service.alert.Alerts;
import com.flamingo.ai.dealflow.service.clustering.DealClusteringService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Links financing events to deals.
 *
 * <p>A pass first assembles events from new financing facts, then applies manual corrections,
 * then scores every unlinked or pending event against the active deals. Linking attaches the
 * event's source fact and participant facts to the deal.
 */
@Service
@Slf4j
public class ReconciliationService {

  private final FinancingEventAssembler assembler;
  private final Reconciler reconciler;
  private final FinancingEventRepository eventRepository;
  private final FinancingParticipantRepository participantRepository;
  private final AtomicFactRepository factRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final DealRepository dealRepository;
  private final DealClusteringService clusteringService;
  private final AlertService alertService;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public ReconciliationService(
      FinancingEventAssembler assembler,
      Reconciler reconciler,
      FinancingEventRepository eventRepository,
      FinancingParticipantRepository participantRepository,
      AtomicFactRepository factRepository,
      FactAttachmentRepository attachmentRepository,
      DealRepository dealRepository,
      DealClusteringService clusteringService,
      AlertService alertService,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.assembler = assembler;
    this.reconciler = reconciler;
    this.eventRepository = eventRepository;
    this.participantRepository = participantRepository;
    this.factRepository = factRepository;
    this.attachmentRepository = attachmentRepository;
    this.dealRepository = dealRepository;
    this.clusteringService = clusteringService;
    this.alertService = alertService;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  private static final class Tally {
    int scanned;
    int manual;
    int linked;
    int pending;
    int unlinked;
    int retried;
  }

  /**
   * Runs one reconciliation pass.
   *
   * @return counts for the pass
   */
  @Timed(value = "dealflow.reconciliation", description = "Time to run a reconciliation pass")
  public ReconciliationSummary reconcile() {
    FinancingEventAssembler.AssemblySummary assembled = assembler.assemble();
    Tally tally = new Tally();

    applyManualCorrections(tally);

    List<FinancingEvent> pool =
        eventRepository.findByReconciliationStatusInOrderByCreatedAtAsc(
            EnumSet.of(ReconciliationStatus.UNLINKED, ReconciliationStatus.PENDING_REVIEW));
    List<Deal> deals =
        dealRepository.findByStateInOrderByCreatedAtAsc(
            EnumSet.of(DealState.CANDIDATE, DealState.OPEN));
    tally.scanned = pool.size();

    for (FinancingEvent event : pool) {
      ReconciliationDecision decision = reconciler.decide(event, deals);
      try {
        transactionTemplate.executeWithoutResult(status -> apply(event, decision, tally));
      } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
        tally.retried++;
        log.warn(
            "Concurrent update while reconciling event {}; retrying next pass: {}",
            event.getId(),
            e.getMessage());
      }
    }

    ReconciliationSummary summary =
        new ReconciliationSummary(
            assembled.eventsCreated(),
            assembled.participantsAdded(),
            tally.scanned,
            tally.manual,
            tally.linked,
            tally.pending,
            tally.unlinked,
            tally.retried);
    log.info(
        "Reconciliation pass: {} events scanned, {} manual links, {} linked, {} pending review, "
            + "{} unlinked, {} retried",
        summary.eventsScanned(),
        summary.manualLinks(),
        summary.linked(),
        summary.pendingReview(),
        summary.unlinked(),
        summary.retried());
    return summary;
  }

  private void apply(FinancingEvent event, ReconciliationDecision decision, Tally tally) {
    switch (decision.outcome()) {
      case LINK -> {
        event.link(decision.dealId(), decision.confidence(), decision.explanation());
        eventRepository.save(event);
        attachEvidence(event, decision.dealId());
        tally.linked++;
        meterRegistry.counter("dealflow.reconciliation.linked").increment();
        log.info(
            "Linked financing event {} to deal {} at {}: {}",
            event.getId(),
            decision.dealId(),
            String.format("%.2f", decision.confidence()),
            decision.explanation());
      }
      case LOW_CONFIDENCE, AMBIGUOUS -> {
        tally.pending++;
        if (unchangedReview(event, decision)) {
          return;
        }
        event.holdForReview(decision.candidates(), decision.confidence(), decision.explanation());
        eventRepository.save(event);
        alertService.raise(
            decision.outcome() == ReconciliationDecision.Outcome.AMBIGUOUS
                ? Alerts.ambiguousReconciliation(
                    event, decision.candidates(), decision.explanation())
                : Alerts.lowConfidenceMatch(event, decision.candidates(), decision.explanation()));
        meterRegistry
            .counter("dealflow.reconciliation.review", "outcome", decision.outcome().name())
            .increment();
        log.info(
            "Financing event {} held for review ({}): {}",
            event.getId(),
            decision.outcome(),
            decision.explanation());
      }
      case NO_MATCH -> {
        tally.unlinked++;
        log.debug("No deal matches financing event {}", event.getId());
      }
      default -> throw new IllegalStateException("Unexpected outcome " + decision.outcome());
    }
  }

  private static boolean unchangedReview(FinancingEvent event, ReconciliationDecision decision) {
    return event.getReconciliationStatus() == ReconciliationStatus.PENDING_REVIEW
        && event.getCandidateDealIds()
            .equals(decision.candidates().stream().map(UUID::toString).toList());
  }

  /** Manual corrections link their event with full confidence, whatever its current status. */
  private void applyManualCorrections(Tally tally) {
    List<AtomicFact> corrections =
        factRepository.findUnattachedByKindIn(EnumSet.of(FactKind.MANUAL_CORRECTION)).stream()
            .sorted(Comparator.comparing(AtomicFact::getCreatedAt))
            .toList();
    for (AtomicFact correction : corrections) {
      try {
        Boolean applied =
            transactionTemplate.execute(status -> applyManualCorrection(correction));
        if (Boolean.TRUE.equals(applied)) {
          tally.manual++;
        }
      } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
        tally.retried++;
        log.warn(
            "Concurrent update applying correction {}: {}", correction.getId(), e.getMessage());
      }
    }
  }

  private boolean applyManualCorrection(AtomicFact correction) {
    Optional<UUID> eventId =
        correction.payloadValue(PayloadKeys.FINANCING_EVENT_ID).map(UUID::fromString);
    Optional<UUID> dealId = correction.payloadValue(PayloadKeys.DEAL_ID).map(UUID::fromString);
    if (eventId.isEmpty() || dealId.isEmpty()) {
      log.warn("Manual correction {} names no event or deal", correction.getId());
      return false;
    }
    Optional<FinancingEvent> event = eventRepository.findById(eventId.get());
    Optional<Deal> deal =
        dealRepository.findById(dealId.get()).map(clusteringService::followMerges);
    if (event.isEmpty() || deal.isEmpty()) {
      log.warn(
          "Manual correction {} names unknown event {} or deal {}",
          correction.getId(),
          eventId.get(),
          dealId.get());
      return false;
    }
    UUID target = deal.get().getId();
    String explanation =
        "Manual correction by "
            + correction.getEnteredBy()
            + (correction.getNote() == null ? "" : ": " + correction.getNote());
    event.get().link(target, 1.0, explanation);
    eventRepository.save(event.get());
    attachmentRepository.save(
        FactAttachment.attach(correction, target, FactAttachment.RECONCILIATION));
    attachEvidence(event.get(), target);
    meterRegistry.counter("dealflow.reconciliation.manual").increment();
    log.info("Manually linked financing event {} to deal {}", eventId.get(), target);
    return true;
  }

  /** Attaches the event's source and participant facts to the deal it was linked to. */
  private void attachEvidence(FinancingEvent event, UUID dealId) {
    List<UUID> factIds = new ArrayList<>();
    factIds.add(event.getSourceFactId());
    participantRepository.findByFinancingEventId(event.getId()).stream()
        .map(FinancingParticipant::getSourceFactId)
        .filter(id -> id != null && !factIds.contains(id))
        .forEach(factIds::add);

    for (UUID factId : factIds) {
      Optional<FactAttachment> existing = attachmentRepository.findByFactId(factId);
      if (existing.isPresent()) {
        FactAttachment attachment = existing.get();
        if (attachment.isAttached()
            && FactAttachment.RECONCILIATION.equals(attachment.getAttachedBy())
            && !dealId.equals(attachment.getDealId())) {
          attachment.reassignTo(dealId);
          attachmentRepository.save(attachment);
        }
        continue;
      }
      factRepository
          .findById(factId)
          .ifPresent(
              fact ->
                  attachmentRepository.save(
                      FactAttachment.attach(fact, dealId, FactAttachment.RECONCILIATION)));
    }
  }
}
