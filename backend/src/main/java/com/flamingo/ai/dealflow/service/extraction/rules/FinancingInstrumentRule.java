package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.MoneyParser;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Emits {@code FINANCING_MENTION} facts for debt securities and credit facilities, with the amount,
 * coupon, maturity and the acquisition the financing is for when the text names one.
 */
@Component
@RequiredArgsConstructor
public class FinancingInstrumentRule implements ExtractionRule {

  public static final String NAME = "financing-instrument";

  static final String PURPOSE_ACQUISITION = "ACQUISITION";
  static final String PURPOSE_REFINANCING = "REFINANCING";
  static final String PURPOSE_GENERAL = "GENERAL_CORPORATE";

  private static final String FILLER =
      "(?:(?:aggregate|principal|amount|of|its|in|an|a|the|new|senior|secured|unsecured"
          + "|first[- ]lien|second[- ]lien|committed|incremental)\\s+){0,6}";

  private static final Pattern DEBT_SECURITY =
      Pattern.compile(
          MoneyParser.AMOUNT_REGEX
              + "\\s+"
              + FILLER
              + "(?:(?<rate>\\d{1,2}(?:\\.\\d{1,4})?)\\s?%\\s+)?"
              + "(?<instrument>(?:senior\\s+secured\\s+|senior\\s+unsecured\\s+|senior\\s+"
              + "|subordinated\\s+|convertible\\s+|secured\\s+)?(?:notes?|bonds?|debentures?))"
              + "(?:\\s+due\\s+(?<maturity>\\d{4}))?",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern CREDIT_FACILITY =
      Pattern.compile(
          MoneyParser.AMOUNT_REGEX
              + "\\s+"
              + FILLER
              + "(?<instrument>revolving\\s+credit\\s+facilit(?:y|ies)|revolving\\s+facility"
              + "|revolver|rcf|bridge\\s+(?:loan\\s+)?facility|bridge\\s+loans?"
              + "|term\\s+loan\\s+[AB](?:\\s+facility)?\\b|term\\s+loan(?:\\s+facility)?"
              + "|credit\\s+facilit(?:y|ies))",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern PURPOSE_TARGET =
      Pattern.compile(
          "(?:(?i:acquisition\\s+of)|(?i:merger\\s+with)|(?i:to\\s+finance\\s+the))\\s+(?:the\\s+)?"
              + "(?<target>[A-Z][\\w&'.-]*(?:\\s+(?:[A-Z][\\w&'.-]*|&))*)");

  private static final Pattern REFINANCING =
      Pattern.compile("\\brefinanc(?:e|ing)\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern GENERAL_PURPOSE =
      Pattern.compile("\\bgeneral\\s+corporate\\s+purposes\\b", Pattern.CASE_INSENSITIVE);

  private static final int PURPOSE_RADIUS = 300;

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    String text = context.fullText();
    List<RuleMatch> matches = new ArrayList<>();
    collect(text, DEBT_SECURITY, matches);
    collect(text, CREDIT_FACILITY, matches);
    matches.sort(Comparator.comparingInt(RuleMatch::start));
    return matches;
  }

  private void collect(String text, Pattern pattern, List<RuleMatch> matches) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      int start = matcher.start();
      int end = matcher.end();
      if (matches.stream().anyMatch(m -> m.start() < end && start < m.end())) {
        continue;
      }
      Map<String, String> payload = new HashMap<>();
      payload.put(PayloadKeys.INSTRUMENT_TYPE, collapse(matcher.group("instrument")));
      payload.put(PayloadKeys.AMOUNT, MoneyParser.format(MoneyParser.valueOf(matcher)));
      payload.put(PayloadKeys.CURRENCY, "USD");
      if (pattern == DEBT_SECURITY) {
        putIfPresent(payload, PayloadKeys.INTEREST_RATE, matcher.group("rate"));
        putIfPresent(payload, PayloadKeys.MATURITY_YEAR, matcher.group("maturity"));
      }
      addPurpose(text, start, end, payload);
      matches.add(
          new RuleMatch(
              FactKind.FINANCING_MENTION,
              payload,
              start,
              end,
              config.getExtraction().getFinancingConfidence(),
              NAME));
    }
  }

  private static void addPurpose(String text, int start, int end, Map<String, String> payload) {
    int from = Math.max(0, start - PURPOSE_RADIUS);
    int to = Math.min(text.length(), end + PURPOSE_RADIUS);
    Matcher target = PURPOSE_TARGET.matcher(text);
    target.region(from, to);
    if (target.find()) {
      String raw = stripTrailingWord(target.group("target"), "Acquisition", "Merger");
      String normalized = PartyNameNormalizer.normalize(raw);
      if (!normalized.isEmpty()) {
        payload.put(PayloadKeys.PURPOSE, PURPOSE_ACQUISITION);
        payload.put(PayloadKeys.PURPOSE_TARGET_RAW, raw);
        payload.put(PayloadKeys.PURPOSE_TARGET_NORMALIZED, normalized);
        return;
      }
    }
    String window = text.substring(from, to);
    if (REFINANCING.matcher(window).find()) {
      payload.put(PayloadKeys.PURPOSE, PURPOSE_REFINANCING);
    } else if (GENERAL_PURPOSE.matcher(window).find()) {
      payload.put(PayloadKeys.PURPOSE, PURPOSE_GENERAL);
    }
  }

  /** {@code to finance the Beta Acquisition} names Beta, not "Beta Acquisition". */
  private static String stripTrailingWord(String value, String... words) {
    String result = stripTrailingPunctuation(value.trim());
    for (String word : words) {
      if (result.endsWith(" " + word)) {
        result = result.substring(0, result.length() - word.length() - 1).trim();
      }
    }
    return stripTrailingPunctuation(result);
  }

  private static String stripTrailingPunctuation(String value) {
    String result = value;
    while (result.endsWith(".") || result.endsWith(",")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static String collapse(String value) {
    return value.trim().replaceAll("\\s+", " ");
  }

  private static void putIfPresent(Map<String, String> payload, String key, String value) {
    if (value != null && !value.isBlank()) {
      payload.put(key, value.trim());
    }
  }
}
