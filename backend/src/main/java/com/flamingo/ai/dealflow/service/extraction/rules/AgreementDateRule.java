package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Emits the agreement date found in the preamble as a {@code DEAL_DATE} fact. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgreementDateRule implements ExtractionRule {

  public static final String NAME = "agreement-date";

  static final String DATE_TYPE_AGREEMENT = "AGREEMENT";

  private static final String MONTH =
      "(?<month>January|February|March|April|May|June|July|August|September|October|November"
          + "|December)";

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile(
              "\\bdated\\s+(?:as\\s+of\\s+)?"
                  + MONTH
                  + "\\s+(?<day>\\d{1,2}),?\\s+(?<year>\\d{4})",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\\bentered\\s+into\\s+(?:on\\s+|as\\s+of\\s+)?"
                  + MONTH
                  + "\\s+(?<day>\\d{1,2}),?\\s+(?<year>\\d{4})",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\\bdated\\s+(?:as\\s+of\\s+)?the\\s+(?<day>\\d{1,2})(?:st|nd|rd|th)?"
                  + "\\s+day\\s+of\\s+"
                  + MONTH
                  + ",?\\s+(?<year>\\d{4})",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\\bdated\\s+(?:as\\s+of\\s+)?"
                  + "(?<year>\\d{4})-(?<monthNumber>\\d{2})-(?<day>\\d{2})\\b",
              Pattern.CASE_INSENSITIVE));

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    String window = context.window(config.getExtraction().getDateWindow());
    RuleMatch earliest = null;
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(window);
      while (matcher.find()) {
        Optional<LocalDate> date = toDate(matcher);
        if (date.isEmpty()) {
          log.debug("Skipping invalid calendar date '{}'", matcher.group());
          continue;
        }
        if (earliest == null || matcher.start() < earliest.start()) {
          earliest =
              new RuleMatch(
                  FactKind.DEAL_DATE,
                  Map.of(
                      PayloadKeys.DATE, date.get().toString(),
                      PayloadKeys.DATE_TYPE, DATE_TYPE_AGREEMENT),
                  matcher.start(),
                  matcher.end(),
                  config.getExtraction().getDateConfidence(),
                  NAME);
        }
        break;
      }
    }
    return earliest == null ? List.of() : List.of(earliest);
  }

  private static Optional<LocalDate> toDate(Matcher matcher) {
    try {
      int year = Integer.parseInt(matcher.group("year"));
      int day = Integer.parseInt(matcher.group("day"));
      int month =
          hasGroup(matcher, "monthNumber")
              ? Integer.parseInt(matcher.group("monthNumber"))
              : Month.valueOf(matcher.group("month").toUpperCase(Locale.ROOT)).getValue();
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private static boolean hasGroup(Matcher matcher, String group) {
    return matcher.pattern().pattern().contains("(?<" + group + ">");
  }
}
