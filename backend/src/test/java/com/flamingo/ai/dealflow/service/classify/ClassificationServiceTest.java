package com.flamingo.ai.dealflow.service.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.support.InMemoryStore;
import com.flamingo.ai.dealflow.support.TestFacts;
import java.time.LocalDate;
import java.util.List;
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
class ClassificationServiceTest {

  private static final LocalDate FILED = LocalDate.of(2024, 6, 3);

  @Mock private FinancingEventRepository eventRepository;

  private InMemoryStore store;
  private ClassificationService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryStore();
    service =
        new ClassificationService(
            new DealClassifier(new DealflowConfig()),
            store.deals(),
            store.attachments(),
            store.facts(),
            eventRepository,
            InMemoryStore.transactionManager());
    when(eventRepository.findByDealId(any())).thenReturn(List.of());
    when(eventRepository.save(any(FinancingEvent.class))).thenAnswer(i -> i.getArgument(0));
  }

  private Deal addDeal(String target) {
    return store.addDeal(
        Deal.builder()
            .dealKey("name:acme:name:" + target)
            .keyTier(ClusteringKeyTier.NAMES)
            .state(DealState.OPEN)
            .targetNameNormalized(target)
            .build());
  }

  @Test
  @DisplayName("Should tag a sponsor-backed deal and its linked bond as high yield")
  void shouldTagSponsorBackedDeal() {
    // Given
    Deal deal = addDeal("beta");
    AtomicFact kkr = store.addFact(TestFacts.sponsor(UUID.randomUUID(), FILED, 10, "kkr", 0.95));
    store.attachments().save(FactAttachment.attach(kkr, deal.getId(), FactAttachment.CLUSTERING));
    FinancingEvent notes =
        FinancingEvent.builder()
            .id(UUID.randomUUID())
            .instrumentFamily(InstrumentFamily.BOND)
            .instrumentType("senior notes")
            .build();
    notes.link(deal.getId(), 0.8, "target name 'beta' exact");
    when(eventRepository.findByDealId(deal.getId())).thenReturn(List.of(notes));

    // When
    ClassificationService.ClassificationSummary summary = service.classify();

    // Then
    assertThat(summary.dealsClassified()).isEqualTo(1);
    assertThat(summary.eventsTagged()).isEqualTo(1);
    assertThat(summary.sponsorBacked()).isEqualTo(1);
    assertThat(deal.getSponsorBacking()).isEqualTo(SponsorBacking.SPONSOR_BACKED);
    assertThat(notes.getMarketTag()).isEqualTo(MarketTag.HY_BOND);
    assertThat(deal.getMarketTag()).isEqualTo(MarketTag.HY_BOND);
  }

  @Test
  @DisplayName("Should ignore sponsor facts a reviewer dismissed")
  void shouldIgnoreDismissedSponsorFacts() {
    // Given
    Deal deal = addDeal("beta");
    AtomicFact kkr = store.addFact(TestFacts.sponsor(UUID.randomUUID(), FILED, 10, "kkr", 0.95));
    FactAttachment attachment =
        FactAttachment.attach(kkr, deal.getId(), FactAttachment.CLUSTERING);
    attachment.dismiss("analyst", "boilerplate");
    store.attachments().save(attachment);

    // When
    ClassificationService.ClassificationSummary summary = service.classify();

    // Then
    assertThat(summary.strategic()).isEqualTo(1);
    assertThat(deal.getSponsorBacking()).isEqualTo(SponsorBacking.STRATEGIC);
    assertThat(deal.getMarketTag()).isNull();
  }

  @Test
  @DisplayName("Should skip deals superseded by a merge")
  void shouldSkipSupersededDeals() {
    // Given
    Deal survivor = addDeal("beta");
    Deal merged = addDeal("beta systems");
    merged.supersedeBy(survivor.getId());

    // When
    ClassificationService.ClassificationSummary summary = service.classify();

    // Then
    assertThat(summary.dealsClassified()).isEqualTo(1);
    assertThat(merged.getSponsorBacking()).isEqualTo(SponsorBacking.UNKNOWN);
  }

  @Test
  @DisplayName("Should not rewrite events whose tag is unchanged")
  void shouldNotRewriteUnchangedEvents() {
    // Given
    Deal deal = addDeal("beta");
    FinancingEvent loan =
        FinancingEvent.builder()
            .id(UUID.randomUUID())
            .instrumentFamily(InstrumentFamily.LOAN)
            .instrumentType("revolving credit facility")
            .marketTag(MarketTag.OTHER_LOAN)
            .build();
    loan.link(deal.getId(), 0.8, "target name 'beta' exact");
    when(eventRepository.findByDealId(deal.getId())).thenReturn(List.of(loan));

    // When
    service.classify();

    // Then
    verify(eventRepository, never()).save(any());
    assertThat(deal.getMarketTag()).isEqualTo(MarketTag.OTHER_LOAN);
  }
}
