package com.flamingo.ai.dealflow.service.extraction;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses dollar literals such as {@code $1.5 billion} or {@code $750,000,000}. */
public final class MoneyParser {

  /** A dollar literal with an optional scale word. */
  public static final String AMOUNT_REGEX =
      "\\$\\s?(?<number>\\d{1,3}(?:,\\d{3})+|\\d+)(?<fraction>\\.\\d+)?"
          + "(?:\\s*(?<scale>billion|million|thousand|bn|mm|mil|b|m)\\b)?";

  public static final Pattern AMOUNT = Pattern.compile(AMOUNT_REGEX, Pattern.CASE_INSENSITIVE);

  private static final Map<String, BigDecimal> SCALES =
      Map.of(
          "thousand", BigDecimal.valueOf(1_000L),
          "million", BigDecimal.valueOf(1_000_000L),
          "mil", BigDecimal.valueOf(1_000_000L),
          "m", BigDecimal.valueOf(1_000_000L),
          "mm", BigDecimal.valueOf(1_000_000L),
          "billion", BigDecimal.valueOf(1_000_000_000L),
          "bn", BigDecimal.valueOf(1_000_000_000L),
          "b", BigDecimal.valueOf(1_000_000_000L));

  private MoneyParser() {}

  /** Numeric value of a matcher positioned on {@link #AMOUNT} or a pattern embedding it. */
  public static BigDecimal valueOf(Matcher matcher) {
    String number = matcher.group("number").replace(",", "");
    String fraction = matcher.group("fraction");
    BigDecimal value = new BigDecimal(fraction == null ? number : number + fraction);
    String scale = matcher.group("scale");
    if (scale != null) {
      value = value.multiply(SCALES.get(scale.toLowerCase(Locale.ROOT)));
    }
    return value.stripTrailingZeros();
  }

  /** Parses the first dollar literal in {@code text}. */
  public static Optional<BigDecimal> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = AMOUNT.matcher(text);
    return matcher.find() ? Optional.of(valueOf(matcher)) : Optional.empty();
  }

  /** Plain decimal rendering used in fact payloads. */
  public static String format(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
  }
}
