package com.flamingo.ai.dealflow.service.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import com.flamingo.ai.dealflow.support.TestFacts;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DealClassifierTest {

  private static final LocalDate FILED = LocalDate.of(2024, 6, 3);

  private DealClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new DealClassifier(new DealflowConfig());
  }

  private static Deal deal(DealState state) {
    return Deal.builder().id(UUID.randomUUID()).dealKey("k").state(state).build();
  }

  private static AtomicFact manualSponsor(boolean absent, LocalDateTime enteredAt) {
    return AtomicFact.builder()
        .id(UUID.randomUUID())
        .kind(FactKind.SPONSOR_MENTION)
        .provenance(FactProvenance.MANUAL)
        .extractionSource("manual")
        .confidence(1.0)
        .payload(
            absent
                ? Map.of(PayloadKeys.SPONSOR_ABSENT, "true")
                : Map.of(PayloadKeys.SPONSOR_NAME_NORMALIZED, "kkr"))
        .fingerprint("manual:" + UUID.randomUUID())
        .createdAt(enteredAt)
        .build();
  }

  private static FinancingEvent event(InstrumentFamily family, String type, String evidence) {
    return FinancingEvent.builder()
        .instrumentFamily(family)
        .instrumentType(type)
        .evidenceSnippet(evidence)
        .build();
  }

  @Nested
  @DisplayName("Sponsor backing")
  class Backing {

    @Test
    @DisplayName("Should mark a deal with a resolved sponsor as sponsor-backed")
    void shouldMarkSponsorBacked() {
      // Given
      AtomicFact kkr = TestFacts.sponsor(UUID.randomUUID(), FILED, 10, "kkr", 0.95);

      // When
      SponsorBacking backing = classifier.sponsorBacking(deal(DealState.OPEN), List.of(kkr));

      // Then
      assertThat(backing).isEqualTo(SponsorBacking.SPONSOR_BACKED);
    }

    @Test
    @DisplayName("Should leave the tag unknown for unresolved or weak sponsor evidence")
    void shouldStayUnknown_forWeakEvidence() {
      // Given
      AtomicFact weak = TestFacts.sponsor(UUID.randomUUID(), FILED, 10, "kkr", 0.6);
      AtomicFact unresolved =
          TestFacts.base(FactKind.SPONSOR_MENTION, UUID.randomUUID(), FILED, 30)
              .confidence(0.85)
              .payload(
                  Map.of(
                      PayloadKeys.SPONSOR_NAME_NORMALIZED, "example capital partners",
                      PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "true"))
              .build();

      // When
      SponsorBacking backing =
          classifier.sponsorBacking(deal(DealState.OPEN), List.of(weak, unresolved));

      // Then
      assertThat(backing).isEqualTo(SponsorBacking.UNKNOWN);
    }

    @Test
    @DisplayName("Should call an open deal without sponsor evidence strategic")
    void shouldMarkOpenDealStrategic() {
      assertThat(classifier.sponsorBacking(deal(DealState.OPEN), List.of()))
          .isEqualTo(SponsorBacking.STRATEGIC);
      assertThat(classifier.sponsorBacking(deal(DealState.CANDIDATE), List.of()))
          .isEqualTo(SponsorBacking.UNKNOWN);
    }

    @Test
    @DisplayName("Should let the latest manual sponsor fact decide")
    void shouldFollowLatestManualFact() {
      // Given
      AtomicFact automatic = TestFacts.sponsor(UUID.randomUUID(), FILED, 10, "kkr", 0.95);
      AtomicFact earlier = manualSponsor(false, LocalDateTime.of(2024, 6, 4, 9, 0));
      AtomicFact later = manualSponsor(true, LocalDateTime.of(2024, 6, 5, 9, 0));

      // When
      SponsorBacking backing =
          classifier.sponsorBacking(deal(DealState.OPEN), List.of(later, automatic, earlier));

      // Then
      assertThat(backing).isEqualTo(SponsorBacking.STRATEGIC);
    }
  }

  @Nested
  @DisplayName("Market tags")
  class Tags {

    @ParameterizedTest(name = "{0} / {1} -> {3}")
    @CsvSource({
      "LOAN, senior secured bridge facility, '', BRIDGE",
      "UNKNOWN, interim financing, '', BRIDGE",
      "LOAN, Term Loan B, '', TERM_LOAN_B",
      "LOAN, term loan, leveraged loan market, TERM_LOAN_B",
      "LOAN, revolving credit facility, '', OTHER_LOAN",
      "LOAN, term loan, '', OTHER_LOAN",
      "BOND, senior notes, notes rated BB+ by S&P, HY_BOND",
      "BOND, senior notes, notes rated BBB+ by S&P, IG_BOND",
      "BOND, senior notes, an investment-grade offering, IG_BOND",
      "UNKNOWN, commitment, '', UNKNOWN"
    })
    @DisplayName("Should tag events by instrument wording and credit quality")
    void shouldTagEvents(
        InstrumentFamily family, String type, String evidence, MarketTag expected) {
      assertThat(classifier.eventTag(event(family, type, evidence), SponsorBacking.STRATEGIC))
          .isEqualTo(expected);
    }

    @Test
    @DisplayName("Should fall back to sponsor backing for bonds without a quality signal")
    void shouldUseSponsorBackingForPlainBonds() {
      // Given
      FinancingEvent notes =
          event(InstrumentFamily.BOND, "senior notes", "issued a series of notes");

      // When / Then
      assertThat(classifier.eventTag(notes, SponsorBacking.SPONSOR_BACKED))
          .isEqualTo(MarketTag.HY_BOND);
      assertThat(classifier.eventTag(notes, SponsorBacking.STRATEGIC))
          .isEqualTo(MarketTag.IG_BOND);
    }

    @Test
    @DisplayName("Should pick the headline deal tag by priority")
    void shouldPickDealTagByPriority() {
      assertThat(
              classifier.dealTag(
                  List.of(MarketTag.OTHER_LOAN, MarketTag.IG_BOND, MarketTag.TERM_LOAN_B)))
          .contains(MarketTag.TERM_LOAN_B);
      assertThat(classifier.dealTag(List.of(MarketTag.OTHER_LOAN)))
          .contains(MarketTag.OTHER_LOAN);
      assertThat(classifier.dealTag(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should prefer a known loan over an unknown tag whatever the event order")
    void shouldPickLowPriorityTagIndependentOfOrder() {
      assertThat(classifier.dealTag(List.of(MarketTag.UNKNOWN, MarketTag.OTHER_LOAN)))
          .contains(MarketTag.OTHER_LOAN);
      assertThat(classifier.dealTag(List.of(MarketTag.OTHER_LOAN, MarketTag.UNKNOWN)))
          .contains(MarketTag.OTHER_LOAN);
    }
  }
}
