package com.flamingo.ai.dealflow.service.attribution;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingParticipantRepository;
import com.flamingo.ai.dealflow.exception.DealNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Writes modeled fees onto deals, linked financing events and their participants. */
@Service
@Slf4j
public class AttributionService {

  private final AttributionEngine engine;
  private final DealRepository dealRepository;
  private final FinancingEventRepository eventRepository;
  private final FinancingParticipantRepository participantRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final AtomicFactRepository factRepository;
  private final TransactionTemplate transactionTemplate;

  public AttributionService(
      AttributionEngine engine,
      DealRepository dealRepository,
      FinancingEventRepository eventRepository,
      FinancingParticipantRepository participantRepository,
      FactAttachmentRepository attachmentRepository,
      AtomicFactRepository factRepository,
      PlatformTransactionManager transactionManager) {
    this.engine = engine;
    this.dealRepository = dealRepository;
    this.eventRepository = eventRepository;
    this.participantRepository = participantRepository;
    this.attachmentRepository = attachmentRepository;
    this.factRepository = factRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Counts and totals for one attribution pass. */
  public record AttributionSummary(
      int dealsAttributed,
      int eventsAttributed,
      BigDecimal totalAdvisoryFees,
      BigDecimal totalUnderwritingFees) {}

  /**
   * A financial advisor's modeled share of a deal's advisory fee.
   *
   * @param advisorName display name as found in the advisor fact
   * @param fee modeled share
   */
  public record AdvisorShare(String advisorName, BigDecimal fee) {}

  @Timed(value = "dealflow.attribution", description = "Time to compute modeled fees")
  public AttributionSummary attribute() {
    List<Deal> deals =
        dealRepository.findByStateInOrderByCreatedAtAsc(EnumSet.allOf(DealState.class));
    int attributed = 0;
    int events = 0;
    BigDecimal advisory = BigDecimal.ZERO;
    BigDecimal underwriting = BigDecimal.ZERO;
    for (Deal deal : deals) {
      if (deal.isSuperseded()) {
        continue;
      }
      Integer eventCount = transactionTemplate.execute(status -> attribute(deal));
      attributed++;
      events += eventCount == null ? 0 : eventCount;
      if (deal.getAdvisoryFeeEstimate() != null) {
        advisory = advisory.add(deal.getAdvisoryFeeEstimate());
      }
      if (deal.getUnderwritingFeeEstimate() != null) {
        underwriting = underwriting.add(deal.getUnderwritingFeeEstimate());
      }
    }
    log.info(
        "Attributed fees for {} deals and {} financing events: advisory {}, underwriting {}",
        attributed,
        events,
        advisory,
        underwriting);
    return new AttributionSummary(attributed, events, advisory, underwriting);
  }

  /** Computes the fees of one deal; returns the number of events given a fee. */
  int attribute(Deal deal) {
    deal.setAdvisoryFeeEstimate(engine.advisoryFee(deal.getDealValue()).orElse(null));

    BigDecimal underwriting = null;
    int attributed = 0;
    for (FinancingEvent event : eventRepository.findByDealId(deal.getId())) {
      if (!event.isLinked()) {
        continue;
      }
      Optional<BigDecimal> fee = engine.underwritingFee(event);
      event.setModeledFee(fee.orElse(null));
      eventRepository.save(event);
      if (fee.isEmpty()) {
        continue;
      }
      attributed++;
      underwriting = underwriting == null ? fee.get() : underwriting.add(fee.get());
      allocate(event, fee.get());
    }
    deal.setUnderwritingFeeEstimate(underwriting);
    dealRepository.save(deal);
    return attributed;
  }

  private void allocate(FinancingEvent event, BigDecimal fee) {
    List<FinancingParticipant> participants =
        participantRepository.findByFinancingEventId(event.getId());
    if (participants.isEmpty()) {
      return;
    }
    List<AttributionEngine.Share> shares =
        engine.splitUnderwriting(
            fee,
            event.getInstrumentFamily(),
            participants.stream().map(FinancingParticipant::getRoleNormalized).toList());
    for (int i = 0; i < participants.size(); i++) {
      FinancingParticipant participant = participants.get(i);
      participant.setRoleWeight(shares.get(i).weight().doubleValue());
      participant.setEstimatedFee(shares.get(i).fee());
    }
    participantRepository.saveAll(participants);
    log.debug(
        "Allocated {} across {} participants of event {}",
        fee,
        participants.size(),
        event.getId());
  }

  /**
   * Splits a deal's modeled advisory fee across the financial advisors attached to it.
   *
   * @throws DealNotFoundException if the deal does not exist
   */
  @Transactional(readOnly = true)
  public List<AdvisorShare> advisoryShares(UUID dealId) {
    Deal deal =
        dealRepository.findById(dealId).orElseThrow(() -> new DealNotFoundException(dealId));
    if (deal.getAdvisoryFeeEstimate() == null) {
      return List.of();
    }
    List<UUID> factIds =
        attachmentRepository.findByDealId(dealId).stream()
            .filter(FactAttachment::isAttached)
            .map(FactAttachment::getFactId)
            .toList();
    Map<String, String> advisors = new LinkedHashMap<>();
    for (AtomicFact fact : factRepository.findAllById(factIds)) {
      if (fact.getKind() != FactKind.ADVISOR_MENTION) {
        continue;
      }
      String raw = fact.payloadValue(PayloadKeys.ADVISOR_NAME_RAW).orElse(null);
      String key = fact.payloadValue(PayloadKeys.ADVISOR_NAME_NORMALIZED).orElse(raw);
      if (key != null) {
        advisors.putIfAbsent(key, raw);
      }
    }
    List<AttributionEngine.Share> shares =
        engine.splitAdvisory(deal.getAdvisoryFeeEstimate(), advisors.size());
    List<AdvisorShare> result = new ArrayList<>();
    int i = 0;
    for (String name : advisors.values()) {
      result.add(new AdvisorShare(name, shares.get(i++).fee()));
    }
    return result;
  }
}
