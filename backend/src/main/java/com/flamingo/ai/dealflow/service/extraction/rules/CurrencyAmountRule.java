package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.MoneyParser;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Emits a {@code CURRENCY_AMOUNT} fact per dollar literal. Each deal-value phrase tags one amount
 * with the {@code DEAL_VALUE} context: the nearest amount after it in the same sentence, else the
 * nearest one before it. Amounts that name a loan, note or facility are never deal values.
 */
@Component
@RequiredArgsConstructor
public class CurrencyAmountRule implements ExtractionRule {

  public static final String NAME = "currency-amount";

  private static final Pattern DEAL_VALUE_PHRASE =
      Pattern.compile(
          "\\b(?:aggregate\\s+(?:merger\\s+)?consideration|transaction\\s+value|enterprise\\s+value"
              + "|equity\\s+value|valued\\s+at|purchase\\s+price|total\\s+consideration)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final String FINANCING_NOUN =
      "(?:term\\s+loans?|loans?|notes|bonds|debentures|borrowings|revolver"
          + "|(?:credit|bridge|revolving(?:\\s+credit)?)\\s+"
          + "(?:facility|facilities|loans?|agreement)"
          + "|facility|facilities|debt\\s+financing)\\b";

  /** Amount followed by a financing noun, e.g. {@code $500 million senior secured term loan}. */
  private static final Pattern FINANCING_AFTER =
      Pattern.compile(
          "\\s*(?:(?:of|in|aggregate|principal|amount|senior|secured|unsecured|subordinated"
              + "|convertible|first|second|lien|incremental|committed|new|a|an|the|[\\d.]+%)\\s+)*"
              + FINANCING_NOUN,
          Pattern.CASE_INSENSITIVE);

  /** Financing noun introducing the amount, e.g. {@code a term loan of $500 million}. */
  private static final Pattern FINANCING_BEFORE =
      Pattern.compile(
          FINANCING_NOUN + "\\s+(?:of|totaling|in\\s+the\\s+(?:aggregate\\s+)?amount\\s+of)\\s*$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern SENTENCE_BREAK =
      Pattern.compile("(?<=[.!?;])\\s+(?=[A-Z\"(])|\\n");

  private static final int GOVERNING_WINDOW = 60;

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    String text = context.fullText();
    List<Amount> amounts = new ArrayList<>();
    Matcher amount = MoneyParser.AMOUNT.matcher(text);
    while (amount.find()) {
      BigDecimal value = MoneyParser.valueOf(amount);
      if (value.signum() > 0) {
        amounts.add(
            new Amount(amount.start(), amount.end(), value, isFinancing(text, amount)));
      }
    }
    Set<Amount> dealValues = bindDealValues(text, amounts);

    List<RuleMatch> matches = new ArrayList<>();
    for (Amount found : amounts) {
      Map<String, String> payload = new HashMap<>();
      payload.put(PayloadKeys.AMOUNT, MoneyParser.format(found.value()));
      payload.put(PayloadKeys.CURRENCY, "USD");
      if (dealValues.contains(found)) {
        payload.put(PayloadKeys.AMOUNT_CONTEXT, PayloadKeys.AMOUNT_CONTEXT_DEAL_VALUE);
      }
      matches.add(
          new RuleMatch(
              FactKind.CURRENCY_AMOUNT,
              payload,
              found.start(),
              found.end(),
              config.getExtraction().getAmountConfidence(),
              NAME));
    }
    return matches;
  }

  private Set<Amount> bindDealValues(String text, List<Amount> amounts) {
    int radius = config.getExtraction().getAmountContextRadius();
    Set<Amount> bound = new HashSet<>();
    Matcher phrase = DEAL_VALUE_PHRASE.matcher(text);
    while (phrase.find()) {
      int sentenceStart = sentenceStart(text, phrase.start());
      int sentenceEnd = sentenceEnd(text, phrase.end());
      Optional<Amount> after =
          amounts.stream()
              .filter(candidate -> !candidate.financing())
              .filter(candidate -> candidate.start() >= phrase.end())
              .filter(candidate -> candidate.start() <= phrase.end() + radius)
              .filter(candidate -> candidate.end() <= sentenceEnd)
              .findFirst();
      Optional<Amount> before =
          amounts.stream()
              .filter(candidate -> !candidate.financing())
              .filter(candidate -> candidate.end() <= phrase.start())
              .filter(candidate -> candidate.end() >= phrase.start() - radius)
              .filter(candidate -> candidate.start() >= sentenceStart)
              .reduce((first, second) -> second);
      after.or(() -> before).ifPresent(bound::add);
    }
    return bound;
  }

  private static boolean isFinancing(String text, Matcher amount) {
    Matcher following =
        FINANCING_AFTER
            .matcher(text)
            .region(amount.end(), Math.min(text.length(), amount.end() + GOVERNING_WINDOW));
    if (following.lookingAt()) {
      return true;
    }
    return FINANCING_BEFORE
        .matcher(text)
        .region(Math.max(0, amount.start() - GOVERNING_WINDOW), amount.start())
        .find();
  }

  private static int sentenceStart(String text, int position) {
    Matcher breaks = SENTENCE_BREAK.matcher(text).region(0, position);
    int start = 0;
    while (breaks.find()) {
      start = breaks.end();
    }
    return start;
  }

  private static int sentenceEnd(String text, int position) {
    Matcher breaks = SENTENCE_BREAK.matcher(text).region(position, text.length());
    return breaks.find() ? breaks.start() : text.length();
  }

  private record Amount(int start, int end, BigDecimal value, boolean financing) {}
}
