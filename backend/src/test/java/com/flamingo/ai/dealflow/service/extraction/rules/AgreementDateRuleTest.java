package com.flamingo.ai.dealflow.service.extraction.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import com.flamingo.ai.dealflow.service.normalize.TextNormalizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AgreementDateRuleTest {

  private final AgreementDateRule rule = new AgreementDateRule(new DealflowConfig());

  private List<RuleMatch> apply(String text) {
    return rule.apply(
        new ExtractionContext(
            new TextNormalizer().normalizePlainText(text), DocumentKind.MERGER_AGREEMENT));
  }

  @ParameterizedTest(name = "{0}")
  @CsvSource(
      delimiter = '|',
      value = {
        "This Agreement, dated as of June 1, 2024, by and among the parties | 2024-06-01",
        "This Agreement is entered into on March 15 2023 by Parent | 2023-03-15",
        "This Agreement dated the 3rd day of January, 2022 | 2022-01-03",
        "This Agreement dated as of 2021-11-30 between the parties | 2021-11-30"
      })
  @DisplayName("Should parse the supported agreement date forms")
  void shouldParseSupportedDateForms(String text, String expected) {
    // When
    List<RuleMatch> matches = apply(text);

    // Then
    assertThat(matches).singleElement();
    assertThat(matches.get(0).kind()).isEqualTo(FactKind.DEAL_DATE);
    assertThat(matches.get(0).payload())
        .containsEntry(PayloadKeys.DATE, expected)
        .containsEntry(PayloadKeys.DATE_TYPE, AgreementDateRule.DATE_TYPE_AGREEMENT);
  }

  @Test
  @DisplayName("Should keep the earliest date in the text")
  void shouldKeepEarliestDate() {
    // Given
    String text =
        "This Amendment, dated as of July 9, 2024, amends the Agreement dated as of June 1, 2024.";

    // When
    List<RuleMatch> matches = apply(text);

    // Then
    assertThat(matches).singleElement();
    assertThat(matches.get(0).payload()).containsEntry(PayloadKeys.DATE, "2024-07-09");
  }

  @Test
  @DisplayName("Should skip impossible calendar dates")
  void shouldSkipImpossibleDates() {
    assertThat(apply("This Agreement, dated as of February 30, 2024, by and among")).isEmpty();
  }

  @Test
  @DisplayName("Should ignore dates beyond the preamble window")
  void shouldIgnoreDatesBeyondWindow() {
    // Given
    String text = "x ".repeat(1500) + "dated as of June 1, 2024";

    // When / Then
    assertThat(apply(text)).isEmpty();
  }
}
