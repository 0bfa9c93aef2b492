package com.flamingo.ai.dealflow.service.extraction;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical and display forms of company names.
 *
 * <p>The normalized form is the comparison key used by clustering and reconciliation: no
 * parentheticals, no jurisdictional descriptor, no legal suffix, punctuation collapsed, lower case.
 * The display form keeps legal suffixes and capitalization.
 */
public final class PartyNameNormalizer {

  private static final Pattern PARENTHETICAL = Pattern.compile("\\([^()]*\\)");

  private static final Pattern JURISDICTIONAL_DESCRIPTOR =
      Pattern.compile(
          ",?\\s+an?\\s+(?:[A-Z][\\w.]*\\s+){1,3}"
              + "(?i:corporation|limited\\s+liability\\s+company|limited\\s+partnership"
              + "|company|statutory\\s+trust|public\\s+limited\\s+company|societe\\s+anonyme)"
              + "\\b.*$");

  private static final Pattern LEGAL_SUFFIX =
      Pattern.compile(
          "(?:,\\s*|\\s+)(?:Inc|Incorporated|Corp|Corporation|Co|Company|LLC|L\\.L\\.C|Ltd|Limited"
              + "|LP|L\\.P|LLP|L\\.L\\.P|PLC|N\\.A|S\\.A|AG|GmbH|B\\.V|N\\.V|BV|NV)\\.?\\s*$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern NON_NAME_CHARS = Pattern.compile("[^\\p{L}\\p{N}&]+");

  private static final Pattern EDGE_SYMBOLS = Pattern.compile("^[\\s&]+|[\\s&]+$");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final String TRIM_CHARS = " ,.;:-";

  private PartyNameNormalizer() {}

  /**
   * Comparison key for a company name, e.g. {@code "Beta Corp. (the \"Company\")"} becomes {@code
   * "beta"}.
   *
   * @return normalized name, empty when nothing name-like remains
   */
  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    String value = stripParentheticals(name);
    value = JURISDICTIONAL_DESCRIPTOR.matcher(value).replaceFirst("");
    String previous;
    do {
      previous = value;
      value = LEGAL_SUFFIX.matcher(value).replaceFirst("");
    } while (!value.equals(previous) && !value.isBlank());
    if (value.isBlank()) {
      // the name was nothing but a suffix; keep it rather than lose the mention
      value = previous;
    }
    value = NON_NAME_CHARS.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return EDGE_SYMBOLS.matcher(value).replaceAll("");
  }

  /** Human readable name: suffixes kept, descriptors and trailing punctuation dropped. */
  public static String display(String name) {
    if (name == null) {
      return "";
    }
    String value = stripParentheticals(name);
    value = JURISDICTIONAL_DESCRIPTOR.matcher(value).replaceFirst("");
    value = WHITESPACE.matcher(value).replaceAll(" ");
    return trim(value);
  }

  /** True when both names normalize to the same non-empty key. */
  public static boolean sameEntity(String left, String right) {
    String a = normalize(left);
    return !a.isEmpty() && a.equals(normalize(right));
  }

  static String trim(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && TRIM_CHARS.indexOf(value.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && TRIM_CHARS.indexOf(value.charAt(end - 1)) >= 0) {
      end--;
    }
    return value.substring(start, end);
  }

  private static String stripParentheticals(String name) {
    String value = name;
    String previous;
    do {
      previous = value;
      value = PARENTHETICAL.matcher(value).replaceAll(" ");
    } while (!value.equals(previous));
    return value;
  }
}
