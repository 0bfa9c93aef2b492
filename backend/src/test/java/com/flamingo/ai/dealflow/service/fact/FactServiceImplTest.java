package com.flamingo.ai.dealflow.service.fact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.DealNotFoundException;
import com.flamingo.ai.dealflow.exception.DocumentNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FactServiceImplTest {

  @Mock private AtomicFactRepository factRepository;
  @Mock private FactAttachmentRepository attachmentRepository;
  @Mock private SourceDocumentRepository documentRepository;
  @Mock private DealRepository dealRepository;
  @Mock private FinancingEventRepository financingEventRepository;

  private FactServiceImpl factService;
  private SimpleMeterRegistry meterRegistry;
  private UUID dealId;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    factService =
        new FactServiceImpl(
            factRepository,
            attachmentRepository,
            documentRepository,
            dealRepository,
            financingEventRepository,
            meterRegistry);
    dealId = UUID.randomUUID();
    when(dealRepository.existsById(dealId)).thenReturn(true);
    when(factRepository.save(any(AtomicFact.class)))
        .thenAnswer(
            i -> {
              AtomicFact fact = i.getArgument(0);
              ReflectionTestUtils.setField(fact, "id", UUID.randomUUID());
              return fact;
            });
  }

  @Nested
  @DisplayName("Manual facts")
  class ManualFacts {

    @Test
    @DisplayName("Should store a manual fact with full confidence and a unique fingerprint")
    void shouldCreateManualFact() {
      // Given
      UUID alertId = UUID.randomUUID();
      UUID documentId = UUID.randomUUID();
      ManualFactInput input =
          new ManualFactInput(
              FactKind.PARTY_DEFINITION,
              Map.of(PayloadKeys.PARTY_NAME_RAW, "Beta Corp.", PayloadKeys.ROLE, "TARGET"),
              dealId,
              "named on the cover page");

      // When
      AtomicFact fact = factService.createManualFact(input, "analyst", documentId, alertId);

      // Then
      assertThat(fact.getProvenance()).isEqualTo(FactProvenance.MANUAL);
      assertThat(fact.getConfidence()).isEqualTo(1.0);
      assertThat(fact.getFingerprint()).startsWith("manual:");
      assertThat(fact.getEnteredBy()).isEqualTo("analyst");
      assertThat(fact.getTargetDealId()).isEqualTo(dealId);
      assertThat(fact.getSourceAlertId()).isEqualTo(alertId);
      assertThat(fact.getDocumentId()).isEqualTo(documentId);
      assertThat(fact.getPayload())
          .containsEntry(PayloadKeys.PARTY_NAME_NORMALIZED, "beta")
          .containsEntry(PayloadKeys.PARTY_NAME_DISPLAY, "Beta Corp");
      assertThat(
              meterRegistry.counter("dealflow.facts.manual", "kind", "PARTY_DEFINITION").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should require a kind and an author")
    void shouldRequireKindAndAuthor() {
      ManualFactInput input =
          new ManualFactInput(FactKind.FINANCING_MENTION, Map.of(), null, null);

      assertThatThrownBy(() -> factService.createManualFact(null, "analyst", null, null))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> factService.createManualFact(input, " ", null, null))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("author");
      verify(factRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject a fact aimed at an unknown deal")
    void shouldRejectUnknownDeal() {
      ManualFactInput input =
          new ManualFactInput(
              FactKind.FINANCING_MENTION,
              Map.of(PayloadKeys.INSTRUMENT_TYPE, "term loan"),
              UUID.randomUUID(),
              null);

      assertThatThrownBy(() -> factService.createManualFact(input, "analyst", null, null))
          .isInstanceOf(DealNotFoundException.class);
    }

    @Test
    @DisplayName("Should aim submitted facts at the deal unless they name another")
    void shouldDefaultTargetDeal() {
      // Given
      UUID otherDeal = UUID.randomUUID();
      when(dealRepository.existsById(otherDeal)).thenReturn(true);
      ManualFactInput plain =
          new ManualFactInput(
              FactKind.ADVISOR_MENTION,
              Map.of(PayloadKeys.ADVISOR_NAME_RAW, "Lazard"),
              null,
              null);
      ManualFactInput aimed =
          new ManualFactInput(
              FactKind.ADVISOR_MENTION,
              Map.of(PayloadKeys.ADVISOR_NAME_RAW, "Evercore"),
              otherDeal,
              null);

      // When
      List<AtomicFact> facts =
          factService.submitManualFacts(dealId, "analyst", List.of(plain, aimed));

      // Then
      assertThat(facts).extracting(AtomicFact::getTargetDealId).containsExactly(dealId, otherDeal);
      assertThat(facts.get(0).getPayload())
          .containsEntry(PayloadKeys.ADVISOR_NAME_NORMALIZED, "lazard");
    }

    @Test
    @DisplayName("Should refuse to submit facts for an unknown deal")
    void shouldRefuseSubmitForUnknownDeal() {
      assertThatThrownBy(
              () -> factService.submitManualFacts(UUID.randomUUID(), "analyst", List.of()))
          .isInstanceOf(DealNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("Payload completion")
  class Payloads {

    @Test
    @DisplayName("Should reject an unknown party role")
    void shouldRejectUnknownRole() {
      Map<String, String> payload =
          Map.of(PayloadKeys.PARTY_NAME_RAW, "Beta Corp.", PayloadKeys.ROLE, "LANDLORD");

      assertThatThrownBy(() -> factService.completePayload(FactKind.PARTY_MENTION, payload))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("LANDLORD");
    }

    @Test
    @DisplayName("Should accept an explicit sponsor absence without a name")
    void shouldAcceptSponsorAbsence() {
      Map<String, String> payload =
          factService.completePayload(
              FactKind.SPONSOR_MENTION, Map.of(PayloadKeys.SPONSOR_ABSENT, "true"));

      assertThat(payload).doesNotContainKey(PayloadKeys.SPONSOR_NAME_NORMALIZED);
      assertThatThrownBy(() -> factService.completePayload(FactKind.SPONSOR_MENTION, Map.of()))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should require ISO dates and default the date type")
    void shouldValidateDates() {
      assertThat(
              factService.completePayload(
                  FactKind.DEAL_DATE, Map.of(PayloadKeys.DATE, "2024-06-03")))
          .containsEntry(PayloadKeys.DATE_TYPE, "AGREEMENT");
      assertThatThrownBy(
              () ->
                  factService.completePayload(
                      FactKind.DEAL_DATE, Map.of(PayloadKeys.DATE, "June 3, 2024")))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should read dollar literals and plain numbers as amounts")
    void shouldNormalizeAmounts() {
      Map<String, String> literal =
          factService.completePayload(
              FactKind.CURRENCY_AMOUNT, Map.of(PayloadKeys.AMOUNT, "$1.5 billion"));
      Map<String, String> plain =
          factService.completePayload(
              FactKind.CURRENCY_AMOUNT, Map.of(PayloadKeys.AMOUNT, "2,250,000"));

      assertThat(literal)
          .containsEntry(PayloadKeys.AMOUNT, "1500000000")
          .containsEntry(PayloadKeys.CURRENCY, "USD")
          .containsEntry(PayloadKeys.AMOUNT_CONTEXT, PayloadKeys.AMOUNT_CONTEXT_DEAL_VALUE);
      assertThat(plain).containsEntry(PayloadKeys.AMOUNT, "2250000");
      assertThatThrownBy(
              () ->
                  factService.completePayload(
                      FactKind.CURRENCY_AMOUNT, Map.of(PayloadKeys.AMOUNT, "a lot")))
          .isInstanceOf(IllegalArgumentException.class);
    }

    private Map<String, String> correction(UUID eventId, UUID targetDeal) {
      return Map.of(
          PayloadKeys.FINANCING_EVENT_ID,
          eventId.toString(),
          PayloadKeys.DEAL_ID,
          targetDeal.toString());
    }

    @Test
    @DisplayName("Should validate the event and deal of a correction")
    void shouldValidateCorrections() {
      // Given
      UUID eventId = UUID.randomUUID();
      when(financingEventRepository.existsById(eventId)).thenReturn(true);
      Map<String, String> valid = correction(eventId, dealId);
      Map<String, String> unknownEvent = correction(UUID.randomUUID(), dealId);
      Map<String, String> unknownDeal = correction(eventId, UUID.randomUUID());

      // When / Then
      assertThat(factService.completePayload(FactKind.MANUAL_CORRECTION, valid))
          .containsEntry(PayloadKeys.DEAL_ID, dealId.toString());
      assertThatThrownBy(
              () -> factService.completePayload(FactKind.MANUAL_CORRECTION, unknownEvent))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("Unknown financing event");
      assertThatThrownBy(
              () -> factService.completePayload(FactKind.MANUAL_CORRECTION, unknownDeal))
          .isInstanceOf(DealNotFoundException.class);
      assertThatThrownBy(
              () ->
                  factService.completePayload(
                      FactKind.MANUAL_CORRECTION,
                      Map.of(PayloadKeys.FINANCING_EVENT_ID, "nope", PayloadKeys.DEAL_ID, "x")))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Fact listing")
  class Listing {

    @Test
    @DisplayName("Should throw for an unknown document")
    void shouldThrow_whenDocumentUnknown() {
      UUID documentId = UUID.randomUUID();
      when(documentRepository.existsById(documentId)).thenReturn(false);

      assertThatThrownBy(() -> factService.getFactsForDocument(documentId))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should throw for an unknown deal")
    void shouldThrow_whenDealUnknown() {
      assertThatThrownBy(() -> factService.getFactsForDeal(UUID.randomUUID()))
          .isInstanceOf(DealNotFoundException.class);
    }

    @Test
    @DisplayName("Should list document facts in text order")
    void shouldListDocumentFacts() {
      UUID documentId = UUID.randomUUID();
      when(documentRepository.existsById(documentId)).thenReturn(true);
      when(factRepository.findByDocumentIdOrderByEvidenceStartAsc(documentId))
          .thenReturn(List.of());

      assertThat(factService.getFactsForDocument(documentId)).isEmpty();
      verify(factRepository).findByDocumentIdOrderByEvidenceStartAsc(documentId);
    }
  }
}
