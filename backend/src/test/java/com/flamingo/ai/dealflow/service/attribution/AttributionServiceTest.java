package com.flamingo.ai.dealflow.service.attribution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingParticipantRepository;
import com.flamingo.ai.dealflow.exception.DealNotFoundException;
import com.flamingo.ai.dealflow.support.InMemoryStore;
import com.flamingo.ai.dealflow.support.TestFacts;
import com.flamingo.ai.dealflow.support.TestRates;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AttributionServiceTest {

  private static final LocalDate FILED = LocalDate.of(2024, 6, 3);

  @Mock private FinancingEventRepository eventRepository;
  @Mock private FinancingParticipantRepository participantRepository;

  private InMemoryStore store;
  private AttributionService service;
  private Deal deal;

  @BeforeEach
  void setUp() {
    store = new InMemoryStore();
    service =
        new AttributionService(
            new AttributionEngine(TestRates.standard()),
            store.deals(),
            eventRepository,
            participantRepository,
            store.attachments(),
            store.facts(),
            InMemoryStore.transactionManager());
    deal =
        store.addDeal(
            Deal.builder()
                .dealKey("name:acme holdings:name:beta")
                .keyTier(ClusteringKeyTier.NAMES)
                .state(DealState.OPEN)
                .dealValue(new BigDecimal("3200000000"))
                .build());
    when(eventRepository.findByDealId(any())).thenReturn(List.of());
    when(eventRepository.save(any(FinancingEvent.class))).thenAnswer(i -> i.getArgument(0));
    when(participantRepository.findByFinancingEventId(any())).thenReturn(List.of());
  }

  private FinancingEvent linkedEvent(String amount, MarketTag tag) {
    FinancingEvent event =
        FinancingEvent.builder()
            .id(UUID.randomUUID())
            .instrumentFamily(InstrumentFamily.BOND)
            .marketTag(tag)
            .amount(new BigDecimal(amount))
            .build();
    event.link(deal.getId(), 0.8, "target name 'beta' exact");
    return event;
  }

  private static FinancingParticipant participant(UUID eventId, String bank, String role) {
    return FinancingParticipant.builder()
        .id(UUID.randomUUID())
        .financingEventId(eventId)
        .institutionNameRaw(bank)
        .roleNormalized(role)
        .build();
  }

  @Test
  @DisplayName("Should model advisory, underwriting and participant fees")
  void shouldModelFees() {
    // Given
    FinancingEvent notes = linkedEvent("750000000", MarketTag.HY_BOND);
    FinancingParticipant goldman =
        participant(notes.getId(), "Goldman Sachs & Co. LLC", "joint_bookrunner");
    FinancingParticipant wells =
        participant(notes.getId(), "Wells Fargo Securities, LLC", "co_manager");
    when(eventRepository.findByDealId(deal.getId())).thenReturn(List.of(notes));
    when(participantRepository.findByFinancingEventId(notes.getId()))
        .thenReturn(List.of(goldman, wells));

    // When
    AttributionService.AttributionSummary summary = service.attribute();

    // Then
    assertThat(summary.dealsAttributed()).isEqualTo(1);
    assertThat(summary.eventsAttributed()).isEqualTo(1);
    assertThat(deal.getAdvisoryFeeEstimate()).isEqualByComparingTo("9600000");
    assertThat(deal.getUnderwritingFeeEstimate()).isEqualByComparingTo("11250000");
    assertThat(notes.getModeledFee()).isEqualByComparingTo("11250000");
    assertThat(goldman.getEstimatedFee()).isEqualByComparingTo("9000000");
    assertThat(goldman.getRoleWeight()).isEqualTo(1.0);
    assertThat(wells.getEstimatedFee()).isEqualByComparingTo("2250000");
    assertThat(summary.totalUnderwritingFees()).isEqualByComparingTo("11250000");
  }

  @Test
  @DisplayName("Should skip events held for review and amounts below the minimum")
  void shouldSkipUnlinkedAndSmallEvents() {
    // Given
    FinancingEvent pending = linkedEvent("500000000", MarketTag.IG_BOND);
    pending.holdForReview(List.of(deal.getId()), 0.2, "No target match");
    FinancingEvent small = linkedEvent("500000", MarketTag.IG_BOND);
    when(eventRepository.findByDealId(deal.getId())).thenReturn(List.of(pending, small));

    // When
    AttributionService.AttributionSummary summary = service.attribute();

    // Then
    assertThat(summary.eventsAttributed()).isZero();
    assertThat(pending.getModeledFee()).isNull();
    assertThat(small.getModeledFee()).isNull();
    assertThat(deal.getUnderwritingFeeEstimate()).isNull();
  }

  @Test
  @DisplayName("Should split the advisory fee across distinct attached advisors")
  void shouldSplitAdvisoryAcrossAdvisors() {
    // Given
    service.attribute();
    attach(advisor("Goldman Sachs & Co. LLC", "goldman sachs", 10));
    attach(advisor("Goldman Sachs", "goldman sachs", 400));
    attach(advisor("Lazard", "lazard", 90));

    // When
    List<AttributionService.AdvisorShare> shares = service.advisoryShares(deal.getId());

    // Then
    assertThat(shares)
        .extracting(AttributionService.AdvisorShare::advisorName)
        .containsExactly("Goldman Sachs & Co. LLC", "Lazard");
    assertThat(shares)
        .allSatisfy(share -> assertThat(share.fee()).isEqualByComparingTo("4800000"));
  }

  @Test
  @DisplayName("Should throw for an unknown deal")
  void shouldThrow_whenDealUnknown() {
    assertThatThrownBy(() -> service.advisoryShares(UUID.randomUUID()))
        .isInstanceOf(DealNotFoundException.class);
  }

  private AtomicFact advisor(String raw, String normalized, int start) {
    return TestFacts.base(FactKind.ADVISOR_MENTION, UUID.randomUUID(), FILED, start)
        .confidence(0.75)
        .payload(
            Map.of(
                PayloadKeys.ADVISOR_NAME_RAW, raw, PayloadKeys.ADVISOR_NAME_NORMALIZED, normalized))
        .build();
  }

  private void attach(AtomicFact fact) {
    store.addFact(fact);
    store
        .attachments()
        .save(FactAttachment.attach(fact, deal.getId(), FactAttachment.CLUSTERING));
  }
}
