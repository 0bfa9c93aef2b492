package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.service.extraction.rules.AdvisorMentionRule;
import com.flamingo.ai.dealflow.service.extraction.rules.AgreementDateRule;
import com.flamingo.ai.dealflow.service.extraction.rules.CurrencyAmountRule;
import com.flamingo.ai.dealflow.service.extraction.rules.DefinedTermRoleRule;
import com.flamingo.ai.dealflow.service.extraction.rules.FinancingInstrumentRule;
import com.flamingo.ai.dealflow.service.extraction.rules.PartyListRule;
import com.flamingo.ai.dealflow.service.extraction.rules.SponsorRule;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Closed dispatch table from document kind to the rules applied to it.
 *
 * <p>Every kind has an entry; a rule named in the table but missing from the context fails
 * startup.
 */
@Component
@Slf4j
public class ExtractionRuleRegistry {

  private static final Map<DocumentKind, List<String>> TABLE = new EnumMap<>(DocumentKind.class);

  static {
    TABLE.put(
        DocumentKind.MERGER_AGREEMENT,
        List.of(
            PartyListRule.NAME,
            DefinedTermRoleRule.NAME,
            AgreementDateRule.NAME,
            CurrencyAmountRule.NAME,
            SponsorRule.NAME));
    TABLE.put(
        DocumentKind.CURRENT_REPORT,
        List.of(
            PartyListRule.NAME,
            DefinedTermRoleRule.NAME,
            AgreementDateRule.NAME,
            CurrencyAmountRule.NAME,
            SponsorRule.NAME,
            FinancingInstrumentRule.NAME,
            AdvisorMentionRule.NAME));
    TABLE.put(
        DocumentKind.PRESS_RELEASE,
        List.of(
            PartyListRule.NAME,
            SponsorRule.NAME,
            CurrencyAmountRule.NAME,
            FinancingInstrumentRule.NAME,
            AdvisorMentionRule.NAME));
    TABLE.put(
        DocumentKind.MATERIAL_CONTRACT,
        List.of(FinancingInstrumentRule.NAME, CurrencyAmountRule.NAME, SponsorRule.NAME));
    TABLE.put(DocumentKind.OTHER, List.of(SponsorRule.NAME, CurrencyAmountRule.NAME));
  }

  private final Map<DocumentKind, List<ExtractionRule>> rulesByKind =
      new EnumMap<>(DocumentKind.class);

  public ExtractionRuleRegistry(List<ExtractionRule> rules) {
    Map<String, ExtractionRule> byName =
        rules.stream().collect(Collectors.toMap(ExtractionRule::name, Function.identity()));
    for (DocumentKind kind : DocumentKind.values()) {
      List<String> names = TABLE.get(kind);
      if (names == null) {
        throw new IllegalStateException("No extraction rules configured for " + kind);
      }
      rulesByKind.put(
          kind,
          names.stream()
              .map(
                  name -> {
                    ExtractionRule rule = byName.get(name);
                    if (rule == null) {
                      throw new IllegalStateException("Extraction rule not registered: " + name);
                    }
                    return rule;
                  })
              .toList());
    }
    log.info(
        "Extraction rule table ready: {} rules for {} document kinds",
        byName.size(),
        TABLE.size());
  }

  /** Rules applied to documents of {@code kind}, in application order. */
  public List<ExtractionRule> rulesFor(DocumentKind kind) {
    return rulesByKind.get(kind);
  }

  /** True when the party-list rule is mandatory for the kind. */
  public static boolean requiresPartyList(DocumentKind kind) {
    return kind == DocumentKind.MERGER_AGREEMENT;
  }
}
