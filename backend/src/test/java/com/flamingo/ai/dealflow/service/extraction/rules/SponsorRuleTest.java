package com.flamingo.ai.dealflow.service.extraction.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import com.flamingo.ai.dealflow.service.normalize.TextNormalizer;
import com.flamingo.ai.dealflow.service.reference.SponsorSeedList;
import com.flamingo.ai.dealflow.service.reference.SponsorSeedList.Sponsor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SponsorRuleTest {

  private SponsorRule rule;

  @BeforeEach
  void setUp() {
    SponsorSeedList seeds =
        new SponsorSeedList(
            List.of(
                new Sponsor("KKR", List.of("kkr", "kohlberg kravis roberts")),
                new Sponsor("Blackstone", List.of("blackstone"))));
    rule = new SponsorRule(new DealflowConfig(), seeds);
  }

  private List<RuleMatch> apply(String text) {
    return rule.apply(
        new ExtractionContext(
            new TextNormalizer().normalizePlainText(text), DocumentKind.PRESS_RELEASE));
  }

  @Nested
  @DisplayName("Seed tier")
  class SeedTier {

    @Test
    @DisplayName("Should match a seed alias near a sponsor keyword")
    void shouldMatchSeedAlias_nearKeyword() {
      // When
      List<RuleMatch> matches =
          apply("The Company agreed to be acquired by KKR, a global private equity firm.");

      // Then
      assertThat(matches).singleElement();
      RuleMatch match = matches.get(0);
      assertThat(match.kind()).isEqualTo(FactKind.SPONSOR_MENTION);
      assertThat(match.confidence()).isEqualTo(0.95);
      assertThat(match.payload())
          .containsEntry(PayloadKeys.SPONSOR_NAME_DISPLAY, "KKR")
          .containsEntry(PayloadKeys.SPONSOR_NAME_NORMALIZED, "kkr")
          .containsEntry(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "false")
          .containsEntry(PayloadKeys.MATCH_TIER, SponsorRule.TIER_SEED)
          .containsEntry(PayloadKeys.KEYWORD, "private equity");
    }

    @Test
    @DisplayName("Should ignore a seed alias with no sponsor keyword nearby")
    void shouldIgnoreSeedAlias_withoutKeyword() {
      assertThat(apply("Representatives of KKR attended the conference.")).isEmpty();
    }

    @Test
    @DisplayName("Should report nothing when the sponsor role is negated")
    void shouldReportNothing_whenNegated() {
      // When
      List<RuleMatch> matches =
          apply("KKR is not a financial sponsor of the transaction and holds no stake.");

      // Then
      assertThat(matches).isEmpty();
    }
  }

  @Nested
  @DisplayName("Linkage tier")
  class LinkageTier {

    @Test
    @DisplayName("Should emit an unresolved sponsor for an entity outside the seed list")
    void shouldEmitUnresolvedSponsor_forUnknownEntity() {
      // When
      List<RuleMatch> matches =
          apply("On March 3, 2024, funds managed by Example Capital Partners acquired Beta Corp.");

      // Then
      assertThat(matches).singleElement();
      RuleMatch match = matches.get(0);
      assertThat(match.confidence()).isEqualTo(0.85);
      assertThat(match.payload())
          .containsEntry(PayloadKeys.SPONSOR_NAME_RAW, "Example Capital Partners")
          .containsEntry(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "true")
          .containsEntry(PayloadKeys.MATCH_TIER, SponsorRule.TIER_LINKAGE);
    }

    @Test
    @DisplayName("Should resolve a linked entity against the seed list")
    void shouldResolveLinkedEntity_againstSeedList() {
      // When
      List<RuleMatch> matches = apply("Parent is an affiliate of Blackstone Inc. and its funds.");

      // Then
      assertThat(matches).singleElement();
      assertThat(matches.get(0).payload())
          .containsEntry(PayloadKeys.SPONSOR_NAME_RAW, "Blackstone Inc.")
          .containsEntry(PayloadKeys.SPONSOR_NAME_DISPLAY, "Blackstone")
          .containsEntry(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "false")
          .containsEntry(PayloadKeys.MATCH_TIER, SponsorRule.TIER_LINKAGE);
    }

    @Test
    @DisplayName("Should drop a trailing sentence period from the linked entity")
    void shouldDropTrailingPeriod() {
      // When
      List<RuleMatch> matches = apply("The buyer is controlled by Northwind Equity.");

      // Then
      assertThat(matches).singleElement();
      assertThat(matches.get(0).payload())
          .containsEntry(PayloadKeys.SPONSOR_NAME_RAW, "Northwind Equity");
    }

    @Test
    @DisplayName("Should suppress a linkage in a negated context")
    void shouldSuppressLinkage_whenNegated() {
      // When
      List<RuleMatch> matches =
          apply("Parent, which is not a sponsor, is an affiliate of Delta Industries.");

      // Then
      assertThat(matches).isEmpty();
    }
  }
}
