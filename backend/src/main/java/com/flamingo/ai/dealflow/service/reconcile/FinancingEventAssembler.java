package com.flamingo.ai.dealflow.service.reconcile;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.AttachmentDisposition;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingParticipantRepository;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.table.ParticipantRoles;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds financing events from {@code FINANCING_MENTION} facts. Each fact yields at most one
 * event; participants come from the table-role facts of the same document and are added as they
 * appear. A pass only visits facts without an event and documents with unlisted table roles, so
 * running the assembler again only picks up what is new.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FinancingEventAssembler {

  private final AtomicFactRepository factRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final FinancingEventRepository eventRepository;
  private final FinancingParticipantRepository participantRepository;
  private final SourceDocumentRepository documentRepository;
  private final MeterRegistry meterRegistry;

  /** Result of an assembly pass. */
  public record AssemblySummary(int eventsCreated, int participantsAdded) {}

  @Transactional
  public AssemblySummary assemble() {
    List<AtomicFact> financingFacts =
        factRepository.findWithoutFinancingEventByKind(FactKind.FINANCING_MENTION);
    Set<UUID> dismissed = dismissedFactIds(financingFacts);

    Map<UUID, FinancingEvent> touched = new LinkedHashMap<>();
    int created = 0;
    for (AtomicFact fact : financingFacts) {
      if (dismissed.contains(fact.getId())) {
        continue;
      }
      Optional<SourceDocument> document =
          fact.getDocumentId() == null
              ? Optional.empty()
              : documentRepository.findById(fact.getDocumentId());
      FinancingEvent event = eventRepository.save(buildEvent(fact, document));
      touched.put(event.getId(), event);
      created++;
    }
    for (UUID documentId :
        factRepository.findDocumentIdsWithUnlistedParticipants(FactKind.TABLE_ROLE)) {
      eventRepository.findByDocumentId(documentId).forEach(e -> touched.putIfAbsent(e.getId(), e));
    }

    int participants = 0;
    for (FinancingEvent event : touched.values()) {
      participants += addParticipants(event);
    }

    if (created > 0 || participants > 0) {
      meterRegistry.counter("dealflow.financing.events.created").increment(created);
      log.info(
          "Assembled {} financing events and {} participants from {} new facts",
          created,
          participants,
          financingFacts.size());
    }
    return new AssemblySummary(created, participants);
  }

  FinancingEvent buildEvent(AtomicFact fact, Optional<SourceDocument> document) {
    String instrumentType = fact.payloadValue(PayloadKeys.INSTRUMENT_TYPE).orElse(null);
    FinancingEvent event =
        FinancingEvent.builder()
            .sourceFactId(fact.getId())
            .documentId(fact.getDocumentId())
            .instrumentType(instrumentType)
            .instrumentFamily(InstrumentTypes.familyOf(instrumentType))
            .amount(fact.payloadValue(PayloadKeys.AMOUNT).map(this::parseAmount).orElse(null))
            .interestRate(fact.payloadValue(PayloadKeys.INTEREST_RATE).orElse(null))
            .maturityYear(
                fact.payloadValue(PayloadKeys.MATURITY_YEAR).map(this::parseYear).orElse(null))
            .purpose(fact.payloadValue(PayloadKeys.PURPOSE).orElse(null))
            .purposeTargetNormalized(purposeTarget(fact))
            .evidenceSnippet(fact.getEvidenceSnippet())
            .build();
    document.ifPresent(
        doc -> {
          if (doc.getRegistrantName() != null) {
            event.setIssuerNameNormalized(
                blankToNull(PartyNameNormalizer.normalize(doc.getRegistrantName())));
          }
          event.setIssuerIdentifier(doc.getRegistrantIdentifier());
          event.setSponsorNamesNormalized(sponsorsOf(doc.getId()));
        });
    log.debug(
        "Financing event from fact {}: {} {} ({})",
        fact.getId(),
        event.getAmount(),
        instrumentType,
        event.getInstrumentFamily());
    return event;
  }

  private int addParticipants(FinancingEvent event) {
    if (event.getDocumentId() == null) {
      return 0;
    }
    List<AtomicFact> roleFacts =
        factRepository.findByDocumentIdAndKindIn(
            event.getDocumentId(), EnumSet.of(FactKind.TABLE_ROLE));
    Set<UUID> dismissed = dismissedFactIds(roleFacts);
    List<FinancingParticipant> added = new ArrayList<>();
    for (AtomicFact fact : roleFacts) {
      if (dismissed.contains(fact.getId())
          || participantRepository.existsByFinancingEventIdAndSourceFactId(
              event.getId(), fact.getId())) {
        continue;
      }
      String institution = fact.payloadValue(PayloadKeys.INSTITUTION_NAME_RAW).orElse(null);
      if (institution == null) {
        continue;
      }
      String role = fact.payloadValue(PayloadKeys.ROLE).orElse(null);
      added.add(
          FinancingParticipant.builder()
              .financingEventId(event.getId())
              .sourceFactId(fact.getId())
              .institutionNameRaw(institution)
              .institutionNameNormalized(
                  fact.payloadValue(PayloadKeys.INSTITUTION_NAME_NORMALIZED)
                      .orElseGet(() -> PartyNameNormalizer.normalize(institution)))
              .role(role)
              .roleNormalized(ParticipantRoles.normalize(role))
              .tableCoordinates(fact.getTableCoordinates())
              .build());
    }
    participantRepository.saveAll(added);
    return added.size();
  }

  private String purposeTarget(AtomicFact fact) {
    Optional<String> normalized = fact.payloadValue(PayloadKeys.PURPOSE_TARGET_NORMALIZED);
    if (normalized.isPresent()) {
      return normalized.get();
    }
    return fact.payloadValue(PayloadKeys.PURPOSE_TARGET_RAW)
        .map(PartyNameNormalizer::normalize)
        .map(FinancingEventAssembler::blankToNull)
        .orElse(null);
  }

  private List<String> sponsorsOf(UUID documentId) {
    List<AtomicFact> sponsorFacts =
        factRepository.findByDocumentIdAndKindIn(documentId, EnumSet.of(FactKind.SPONSOR_MENTION));
    return sponsorFacts.stream()
        .filter(f -> !isSponsorAbsent(f))
        .map(f -> f.payloadValue(PayloadKeys.SPONSOR_NAME_NORMALIZED).orElse(null))
        .filter(name -> name != null && !name.isBlank())
        .distinct()
        .toList();
  }

  private Set<UUID> dismissedFactIds(List<AtomicFact> facts) {
    if (facts.isEmpty()) {
      return Set.of();
    }
    return attachmentRepository
        .findByFactIdIn(facts.stream().map(AtomicFact::getId).toList())
        .stream()
        .filter(a -> a.getDisposition() == AttachmentDisposition.DISMISSED)
        .map(FactAttachment::getFactId)
        .collect(Collectors.toSet());
  }

  private BigDecimal parseAmount(String value) {
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparseable financing amount '{}'", value);
      return null;
    }
  }

  private Integer parseYear(String value) {
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparseable maturity year '{}'", value);
      return null;
    }
  }

  private static boolean isSponsorAbsent(AtomicFact fact) {
    return fact.payloadValue(PayloadKeys.SPONSOR_ABSENT).map(Boolean::parseBoolean).orElse(false);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
