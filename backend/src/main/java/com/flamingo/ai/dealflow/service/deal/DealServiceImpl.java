package com.flamingo.ai.dealflow.service.deal;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.DealMergeRecord;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealMergeRecordRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingParticipantRepository;
import com.flamingo.ai.dealflow.domain.repository.ProcessingAlertRepository;
import com.flamingo.ai.dealflow.exception.DealNotFoundException;
import com.flamingo.ai.dealflow.exception.InvalidDealStateException;
import com.flamingo.ai.dealflow.service.clustering.DealClusteringService;
import com.flamingo.ai.dealflow.service.clustering.DealIdentityUpdater;
import com.flamingo.ai.dealflow.service.clustering.DealKeyLocks;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Implementation of the DealService. */
@Service
@Slf4j
public class DealServiceImpl implements DealService {

  private final DealRepository dealRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final AtomicFactRepository factRepository;
  private final FinancingEventRepository financingEventRepository;
  private final FinancingParticipantRepository participantRepository;
  private final DealMergeRecordRepository mergeRecordRepository;
  private final ProcessingAlertRepository alertRepository;
  private final DealClusteringService clusteringService;
  private final DealIdentityUpdater identityUpdater;
  private final DealKeyLocks locks;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public DealServiceImpl(
      DealRepository dealRepository,
      FactAttachmentRepository attachmentRepository,
      AtomicFactRepository factRepository,
      FinancingEventRepository financingEventRepository,
      FinancingParticipantRepository participantRepository,
      DealMergeRecordRepository mergeRecordRepository,
      ProcessingAlertRepository alertRepository,
      DealClusteringService clusteringService,
      DealIdentityUpdater identityUpdater,
      DealKeyLocks locks,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.dealRepository = dealRepository;
    this.attachmentRepository = attachmentRepository;
    this.factRepository = factRepository;
    this.financingEventRepository = financingEventRepository;
    this.participantRepository = participantRepository;
    this.mergeRecordRepository = mergeRecordRepository;
    this.alertRepository = alertRepository;
    this.clusteringService = clusteringService;
    this.identityUpdater = identityUpdater;
    this.locks = locks;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "deal.get", description = "Time to get a deal")
  public Deal getDeal(UUID dealId) {
    return dealRepository.findById(dealId).orElseThrow(() -> new DealNotFoundException(dealId));
  }

  @Override
  @Transactional(readOnly = true)
  public Deal getDealByKey(String dealKey) {
    return dealRepository
        .findByDealKey(dealKey)
        .map(clusteringService::followMerges)
        .orElseThrow(() -> new DealNotFoundException(null));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "deal.list", description = "Time to list deals")
  public List<Deal> listDeals(DealState state) {
    return state == null
        ? dealRepository.findAllByOrderByUpdatedAtDesc()
        : dealRepository.findByStateOrderByUpdatedAtDesc(state);
  }

  @Override
  @Transactional(readOnly = true)
  public List<FinancingEvent> getFinancingEvents(UUID dealId) {
    getDeal(dealId);
    return financingEventRepository.findByDealId(dealId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<FinancingParticipant> getParticipants(UUID financingEventId) {
    return participantRepository.findByFinancingEventId(financingEventId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DealMergeRecord> getMergeHistory(UUID dealId) {
    return mergeRecordRepository.findBySurvivingDealIdOrderByMergedAtAsc(dealId);
  }

  @Override
  @Timed(value = "deal.merge", description = "Time to merge two deals")
  public DealMergeRecord merge(UUID survivorId, UUID supersededId, String author, String reason) {
    if (survivorId.equals(supersededId)) {
      throw new IllegalArgumentException("A deal cannot be merged into itself");
    }
    if (author == null || author.isBlank()) {
      throw new IllegalArgumentException("Merge author is required");
    }
    Deal survivorBefore = getDeal(survivorId);
    Deal supersededBefore = getDeal(supersededId);
    Set<String> lockKeys =
        Set.of(
            "deal:" + survivorId,
            "deal:" + supersededId,
            survivorBefore.getDealKey(),
            supersededBefore.getDealKey());

    DealMergeRecord record =
        locks.withLocks(
            lockKeys,
            () ->
                transactionTemplate.execute(
                    status -> doMerge(survivorId, supersededId, author, reason)));
    meterRegistry.counter("dealflow.deals.merged").increment();
    log.info(
        "Merged deal {} into {} by {}: {} facts, {} events moved",
        supersededId,
        survivorId,
        author,
        record.getReassignedFactCount(),
        record.getReassignedEventCount());
    return record;
  }

  private DealMergeRecord doMerge(
      UUID survivorId, UUID supersededId, String author, String reason) {
    Deal survivor = getDeal(survivorId);
    Deal superseded = getDeal(supersededId);
    if (!survivor.getState().acceptsFacts()) {
      throw new InvalidDealStateException(survivorId, survivor.getState(), "merge into");
    }
    String supersededKey = superseded.getDealKey();
    superseded.supersedeBy(survivorId);
    dealRepository.saveAndFlush(superseded);

    List<FactAttachment> attachments = attachmentRepository.findByDealId(supersededId);
    attachments.forEach(attachment -> attachment.reassignTo(survivorId));
    attachmentRepository.saveAll(attachments);

    List<FinancingEvent> events = financingEventRepository.findByDealId(supersededId);
    events.forEach(event -> event.setDealId(survivorId));
    financingEventRepository.saveAll(events);

    List<AtomicFact> moved =
        factRepository.findAllById(
            attachments.stream()
                .filter(FactAttachment::isAttached)
                .map(FactAttachment::getFactId)
                .toList());
    identityUpdater.apply(survivor, moved);
    clusteringService.rekey(survivor);
    clusteringService.promoteIfEligible(survivor);
    dealRepository.save(survivor);

    return mergeRecordRepository.save(
        DealMergeRecord.builder()
            .survivingDealId(survivorId)
            .supersededDealId(supersededId)
            .supersededDealKey(supersededKey)
            .reassignedFactCount(attachments.size())
            .reassignedEventCount(events.size())
            .mergedBy(author)
            .reason(reason)
            .build());
  }

  @Override
  @Transactional
  @Timed(value = "deal.lock", description = "Time to lock a deal")
  public Deal lock(UUID dealId, String actor) {
    Deal deal = getDeal(dealId);
    deal.lock();
    log.info("Deal {} locked by {}", deal.getDealKey(), actor);
    return dealRepository.save(deal);
  }

  @Override
  @Transactional
  @Timed(value = "deal.close", description = "Time to close a deal")
  public Deal close(UUID dealId, String actor) {
    Deal deal = getDeal(dealId);
    deal.close();
    log.info("Deal {} closed by {}", deal.getDealKey(), actor);
    return dealRepository.save(deal);
  }

  @Override
  @Transactional
  @Timed(value = "deal.resume", description = "Time to resume a deal")
  public Deal resume(UUID dealId, DealState resumeTo, String actor) {
    if (resumeTo == DealState.NEEDS_REVIEW) {
      throw new IllegalArgumentException("Cannot resume a deal to NEEDS_REVIEW");
    }
    Deal deal = getDeal(dealId);
    deal.resume(resumeTo);
    boolean dismiss = deal.getState().isTerminal();

    List<ProcessingAlert> conflicts =
        alertRepository.findByDealIdAndKindAndResolvedFalse(
            dealId, AlertKind.CONFLICTING_DEAL_STATE);
    for (ProcessingAlert alert : conflicts) {
      if (dismiss && alert.getFactId() != null) {
        dismissFact(alert.getFactId(), actor, "Deal resumed to " + deal.getState());
      }
      alert.resolve(actor, "Deal resumed to " + deal.getState(), List.of());
    }
    alertRepository.saveAll(conflicts);

    log.info(
        "Deal {} resumed to {} by {}; {} conflicting facts {}",
        deal.getDealKey(),
        deal.getState(),
        actor,
        conflicts.size(),
        dismiss ? "dismissed" : "released");
    return dealRepository.save(deal);
  }

  @Override
  @Transactional
  public FactAttachment dismissFact(UUID factId, String reviewer, String reason) {
    AtomicFact fact =
        factRepository
            .findById(factId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown fact: " + factId));
    FactAttachment attachment =
        attachmentRepository
            .findByFactId(factId)
            .orElseGet(
                () ->
                    FactAttachment.builder()
                        .factId(factId)
                        .documentId(fact.getDocumentId())
                        .build());
    attachment.dismiss(reviewer, reason);
    log.info("Fact {} dismissed by {}: {}", factId, reviewer, reason);
    return attachmentRepository.save(attachment);
  }
}
