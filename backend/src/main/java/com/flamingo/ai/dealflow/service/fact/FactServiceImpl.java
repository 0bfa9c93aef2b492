package com.flamingo.ai.dealflow.service.fact;

import static java.util.Comparator.naturalOrder;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.DealNotFoundException;
import com.flamingo.ai.dealflow.exception.DocumentNotFoundException;
import com.flamingo.ai.dealflow.service.extraction.FactFingerprints;
import com.flamingo.ai.dealflow.service.extraction.MoneyParser;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the FactService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactServiceImpl implements FactService {

  static final String MANUAL_SOURCE = "manual";

  private final AtomicFactRepository factRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final SourceDocumentRepository documentRepository;
  private final DealRepository dealRepository;
  private final FinancingEventRepository financingEventRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "fact.document", description = "Time to list the facts of a document")
  public List<AtomicFact> getFactsForDocument(UUID documentId) {
    if (!documentRepository.existsById(documentId)) {
      throw new DocumentNotFoundException(documentId);
    }
    return factRepository.findByDocumentIdOrderByEvidenceStartAsc(documentId);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "fact.deal", description = "Time to list the facts of a deal")
  public List<AtomicFact> getFactsForDeal(UUID dealId) {
    if (!dealRepository.existsById(dealId)) {
      throw new DealNotFoundException(dealId);
    }
    List<UUID> factIds =
        attachmentRepository.findByDealId(dealId).stream()
            .filter(FactAttachment::isAttached)
            .map(FactAttachment::getFactId)
            .toList();
    return factRepository.findAllById(factIds).stream()
        .sorted(
            Comparator.comparing(AtomicFact::getObservedOn, Comparator.nullsFirst(naturalOrder()))
                .thenComparing(AtomicFact::getCreatedAt, Comparator.nullsFirst(naturalOrder())))
        .toList();
  }

  @Override
  @Transactional
  @Timed(value = "fact.manual", description = "Time to create a manual fact")
  public AtomicFact createManualFact(
      ManualFactInput input, String author, UUID documentId, UUID sourceAlertId) {
    if (input == null || input.kind() == null) {
      throw new IllegalArgumentException("Manual fact kind is required");
    }
    if (author == null || author.isBlank()) {
      throw new IllegalArgumentException("Manual fact author is required");
    }
    if (input.targetDealId() != null && !dealRepository.existsById(input.targetDealId())) {
      throw new DealNotFoundException(input.targetDealId());
    }
    Map<String, String> payload = completePayload(input.kind(), input.payload());

    AtomicFact fact =
        AtomicFact.builder()
            .kind(input.kind())
            .documentId(documentId)
            .provenance(FactProvenance.MANUAL)
            .extractionSource(MANUAL_SOURCE)
            .confidence(1.0)
            .payload(payload)
            .observedOn(LocalDate.now())
            .targetDealId(input.targetDealId())
            .sourceAlertId(sourceAlertId)
            .enteredBy(author)
            .note(input.note())
            .fingerprint(FactFingerprints.manual())
            .build();

    AtomicFact saved = factRepository.save(fact);
    meterRegistry.counter("dealflow.facts.manual", "kind", input.kind().name()).increment();
    log.info("Manual {} fact {} entered by {}", input.kind(), saved.getId(), author);
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "fact.manual.submit", description = "Time to submit manual facts for a deal")
  public List<AtomicFact> submitManualFacts(
      UUID dealId, String author, List<ManualFactInput> inputs) {
    if (!dealRepository.existsById(dealId)) {
      throw new DealNotFoundException(dealId);
    }
    return inputs.stream()
        .map(
            input ->
                input.targetDealId() != null
                    ? input
                    : new ManualFactInput(input.kind(), input.payload(), dealId, input.note()))
        .map(input -> createManualFact(input, author, null, null))
        .toList();
  }

  /** Validates the payload for its kind and fills in the derived name fields. */
  Map<String, String> completePayload(FactKind kind, Map<String, String> raw) {
    Map<String, String> payload = new HashMap<>(raw);
    switch (kind) {
      case PARTY_MENTION, PARTY_DEFINITION -> {
        String name = require(payload, PayloadKeys.PARTY_NAME_RAW, kind);
        String role = require(payload, PayloadKeys.ROLE, kind);
        try {
          PartyRole.valueOf(role);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown party role: " + role, e);
        }
        payload.putIfAbsent(PayloadKeys.PARTY_NAME_DISPLAY, PartyNameNormalizer.display(name));
        payload.putIfAbsent(
            PayloadKeys.PARTY_NAME_NORMALIZED, PartyNameNormalizer.normalize(name));
      }
      case SPONSOR_MENTION -> {
        if (!Boolean.parseBoolean(payload.get(PayloadKeys.SPONSOR_ABSENT))) {
          String name = require(payload, PayloadKeys.SPONSOR_NAME_RAW, kind);
          payload.putIfAbsent(
              PayloadKeys.SPONSOR_NAME_DISPLAY, PartyNameNormalizer.display(name));
          payload.putIfAbsent(
              PayloadKeys.SPONSOR_NAME_NORMALIZED, PartyNameNormalizer.normalize(name));
        }
      }
      case DEAL_DATE -> {
        String date = require(payload, PayloadKeys.DATE, kind);
        try {
          LocalDate.parse(date);
        } catch (DateTimeParseException e) {
          throw new IllegalArgumentException("Date must be ISO yyyy-MM-dd: " + date, e);
        }
        payload.putIfAbsent(PayloadKeys.DATE_TYPE, "AGREEMENT");
      }
      case CURRENCY_AMOUNT -> {
        String amount = require(payload, PayloadKeys.AMOUNT, kind);
        payload.put(PayloadKeys.AMOUNT, MoneyParser.format(parseAmount(amount)));
        payload.putIfAbsent(PayloadKeys.CURRENCY, "USD");
        payload.putIfAbsent(PayloadKeys.AMOUNT_CONTEXT, PayloadKeys.AMOUNT_CONTEXT_DEAL_VALUE);
      }
      case TABLE_ROLE -> {
        String name = require(payload, PayloadKeys.INSTITUTION_NAME_RAW, kind);
        require(payload, PayloadKeys.ROLE, kind);
        payload.putIfAbsent(
            PayloadKeys.INSTITUTION_NAME_NORMALIZED, PartyNameNormalizer.normalize(name));
      }
      case ADVISOR_MENTION -> {
        String name = require(payload, PayloadKeys.ADVISOR_NAME_RAW, kind);
        payload.putIfAbsent(
            PayloadKeys.ADVISOR_NAME_NORMALIZED, PartyNameNormalizer.normalize(name));
      }
      case FINANCING_MENTION -> require(payload, PayloadKeys.INSTRUMENT_TYPE, kind);
      case MANUAL_CORRECTION -> {
        UUID eventId = requireUuid(payload, PayloadKeys.FINANCING_EVENT_ID, kind);
        UUID dealId = requireUuid(payload, PayloadKeys.DEAL_ID, kind);
        if (!financingEventRepository.existsById(eventId)) {
          throw new IllegalArgumentException("Unknown financing event: " + eventId);
        }
        if (!dealRepository.existsById(dealId)) {
          throw new DealNotFoundException(dealId);
        }
      }
      default -> {}
    }
    return payload;
  }

  /** Accepts a plain number ({@code 1500000000}) or a dollar literal ({@code $1.5 billion}). */
  private static BigDecimal parseAmount(String amount) {
    String plain = amount.replace(",", "");
    try {
      return new BigDecimal(plain);
    } catch (NumberFormatException e) {
      return MoneyParser.parse(amount.startsWith("$") ? amount : "$" + amount)
          .orElseThrow(() -> new IllegalArgumentException("Unreadable amount: " + amount, e));
    }
  }

  private static String require(Map<String, String> payload, String key, FactKind kind) {
    String value = payload.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(kind + " fact requires '" + key + "'");
    }
    return value.trim();
  }

  private static UUID requireUuid(Map<String, String> payload, String key, FactKind kind) {
    String value = require(payload, key, kind);
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("'" + key + "' is not a valid id: " + value, e);
    }
  }
}
