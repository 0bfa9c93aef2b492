package com.flamingo.ai.dealflow.service.classify;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Applies {@link DealClassifier} to every live deal and its linked financing events. */
@Service
@Slf4j
public class ClassificationService {

  private final DealClassifier classifier;
  private final DealRepository dealRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final AtomicFactRepository factRepository;
  private final FinancingEventRepository eventRepository;
  private final TransactionTemplate transactionTemplate;

  public ClassificationService(
      DealClassifier classifier,
      DealRepository dealRepository,
      FactAttachmentRepository attachmentRepository,
      AtomicFactRepository factRepository,
      FinancingEventRepository eventRepository,
      PlatformTransactionManager transactionManager) {
    this.classifier = classifier;
    this.dealRepository = dealRepository;
    this.attachmentRepository = attachmentRepository;
    this.factRepository = factRepository;
    this.eventRepository = eventRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Counts for one classification pass. */
  public record ClassificationSummary(
      int dealsClassified, int eventsTagged, int sponsorBacked, int strategic) {}

  @Timed(value = "dealflow.classification", description = "Time to classify deals and events")
  public ClassificationSummary classify() {
    List<Deal> deals =
        dealRepository.findByStateInOrderByCreatedAtAsc(EnumSet.allOf(DealState.class));
    int classified = 0;
    int tagged = 0;
    int sponsorBacked = 0;
    int strategic = 0;
    for (Deal deal : deals) {
      if (deal.isSuperseded()) {
        continue;
      }
      Integer eventsTagged = transactionTemplate.execute(status -> classify(deal));
      classified++;
      tagged += eventsTagged == null ? 0 : eventsTagged;
      if (deal.getSponsorBacking() == SponsorBacking.SPONSOR_BACKED) {
        sponsorBacked++;
      } else if (deal.getSponsorBacking() == SponsorBacking.STRATEGIC) {
        strategic++;
      }
    }
    log.info(
        "Classified {} deals ({} sponsor-backed, {} strategic) and {} financing events",
        classified,
        sponsorBacked,
        strategic,
        tagged);
    return new ClassificationSummary(classified, tagged, sponsorBacked, strategic);
  }

  /** Tags one deal and its linked events; returns the number of events tagged. */
  int classify(Deal deal) {
    List<AtomicFact> facts =
        factRepository.findAllById(
            attachmentRepository.findByDealId(deal.getId()).stream()
                .filter(FactAttachment::isAttached)
                .map(FactAttachment::getFactId)
                .toList());
    SponsorBacking backing = classifier.sponsorBacking(deal, facts);

    List<FinancingEvent> events =
        eventRepository.findByDealId(deal.getId()).stream()
            .filter(FinancingEvent::isLinked)
            .toList();
    List<MarketTag> tags = new ArrayList<>();
    for (FinancingEvent event : events) {
      MarketTag tag = classifier.eventTag(event, backing);
      tags.add(tag);
      if (tag != event.getMarketTag()) {
        log.debug(
            "Financing event {} tagged {} (was {})", event.getId(), tag, event.getMarketTag());
        event.setMarketTag(tag);
        eventRepository.save(event);
      }
    }

    MarketTag dealTag = classifier.dealTag(tags).orElse(null);
    if (backing != deal.getSponsorBacking() || !Objects.equals(dealTag, deal.getMarketTag())) {
      deal.setSponsorBacking(backing);
      deal.setMarketTag(dealTag);
      dealRepository.save(deal);
    }
    return events.size();
  }
}
