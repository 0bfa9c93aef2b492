package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the party list of an agreement preamble and splits it into parties.
 *
 * <p>The list starts after a lead-in such as {@code by and among} and ends at the first sentence
 * terminator: a period outside parentheses that does not close a legal abbreviation, or a block
 * boundary. Splitting never happens inside parentheses or quotes, and commas that introduce a legal
 * suffix or a jurisdictional descriptor do not split.
 */
public final class PartyListParser {

  private static final Pattern LEAD_IN =
      Pattern.compile(
          "\\b(?:(?:made\\s+and\\s+)?entered\\s+into\\s+(?:by\\s+and\\s+)?(?:among|between)"
              + "|made\\s+(?:by\\s+and\\s+)?(?:among|between)"
              + "|by\\s+and\\s+(?:among|between))\\b\\s*",
          Pattern.CASE_INSENSITIVE);

  /** Parenthesized quoted label, optionally introduced by the, hereinafter or referred to as. */
  public static final Pattern DEFINED_TERM =
      Pattern.compile(
          "\\(\\s*(?:(?:hereinafter\\s+)?(?:referred\\s+to\\s+as\\s+)?(?:the\\s+)?)"
              + "[\"'](?<label>[A-Za-z0-9][A-Za-z0-9 \\-]{0,40}?)[\"']\\s*\\)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern LEGAL_SUFFIX_AHEAD =
      Pattern.compile(
          "^\\s*(?:Inc|Incorporated|Corp|Corporation|Co|Company|LLC|L\\.L\\.C|Ltd|Limited|LP|L\\.P"
              + "|LLP|L\\.L\\.P|PLC|N\\.A|S\\.A|AG|GmbH|B\\.V|N\\.V)\\b\\.?",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern DESCRIPTOR_AHEAD =
      Pattern.compile("^\\s*(?:each\\s+)?an?\\s+[A-Z][\\w.]*(?:\\s+[A-Z][\\w.]*){0,2}\\s+[a-z]");

  private static final Pattern LEGAL_SUFFIX_BEHIND =
      Pattern.compile(
          "\\b(?:Inc|Corp|Co|Ltd|LLC|L\\.L\\.C|LP|L\\.P|LLP|PLC|N\\.A|S\\.A|AG|GmbH"
              + "|B\\.V|N\\.V)\\.?$",
          Pattern.CASE_INSENSITIVE);

  private static final Set<String> ABBREVIATIONS =
      Set.of(
          "inc", "corp", "co", "ltd", "l.p", "l.l.c", "l.l.p", "n.a", "s.a", "b.v", "n.v", "p.c",
          "jr", "sr", "no", "bros", "cos", "st", "u.s", "s.a.r.l", "s.p.a", "s.r.l");

  private static final int MAX_LIST_LENGTH = 2000;

  private PartyListParser() {}

  /**
   * A party of the list.
   *
   * @param text party text including any descriptor and defined-term parenthetical
   * @param start inclusive start in the searched text
   * @param end exclusive end in the searched text
   * @param name party name without parentheticals
   * @param label defined-term label, or null
   * @param labelStart start of the defined-term parenthetical, or -1
   * @param labelEnd end of the defined-term parenthetical, or -1
   */
  public record ParsedParty(
      String text, int start, int end, String name, String label, int labelStart, int labelEnd) {

    /** Role implied by the label, if the label is recognized. */
    public Optional<PartyRole> labeledRole() {
      return RoleLabels.roleFor(label);
    }

    public boolean isVehicle() {
      return labeledRole().map(r -> r == PartyRole.ACQUISITION_VEHICLE).orElse(false)
          || RoleLabels.isVehicleName(name);
    }
  }

  /** Located party list. */
  public record PartyList(int start, int end, List<ParsedParty> parties) {}

  /** Finds and splits the first party list in {@code text}; empty if no lead-in is present. */
  public static Optional<PartyList> find(String text) {
    Matcher leadIn = LEAD_IN.matcher(text);
    while (leadIn.find()) {
      int start = leadIn.end();
      int end = terminatorOf(text, start);
      List<ParsedParty> parties = split(text, start, end);
      if (!parties.isEmpty()) {
        return Optional.of(new PartyList(start, end, parties));
      }
    }
    return Optional.empty();
  }

  /** Exclusive end of the party list starting at {@code start}. */
  static int terminatorOf(String text, int start) {
    int limit = Math.min(text.length(), start + MAX_LIST_LENGTH);
    int depth = 0;
    for (int i = start; i < limit; i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
      } else if (c == '\n' && i + 1 < limit && text.charAt(i + 1) == '\n') {
        return i;
      } else if (c == '.' && depth == 0 && isSentenceEnd(text, i)) {
        return i;
      }
    }
    return limit;
  }

  private static boolean isSentenceEnd(String text, int period) {
    if (period + 1 < text.length() && Character.isLetterOrDigit(text.charAt(period + 1))) {
      return false;
    }
    if (!closesAbbreviation(text, period)) {
      return true;
    }
    // an abbreviation ends the sentence only when a new capitalized sentence follows
    int next = period + 1;
    while (next < text.length() && text.charAt(next) == ' ') {
      next++;
    }
    if (next >= text.length() || text.charAt(next) == '\n') {
      return true;
    }
    return next > period + 1 && Character.isUpperCase(text.charAt(next));
  }

  private static boolean closesAbbreviation(String text, int period) {
    int begin = period;
    while (begin > 0
        && (Character.isLetter(text.charAt(begin - 1)) || text.charAt(begin - 1) == '.')) {
      begin--;
    }
    String token = text.substring(begin, period);
    if (token.length() == 1 && Character.isUpperCase(token.charAt(0))) {
      return true;
    }
    return ABBREVIATIONS.contains(token.toLowerCase(Locale.ROOT));
  }

  /** Splits {@code text[start, end)} into parties. */
  static List<ParsedParty> split(String text, int start, int end) {
    List<int[]> spans = new ArrayList<>();
    int depth = 0;
    boolean inQuote = false;
    int segmentStart = start;
    int i = start;
    while (i < end) {
      char c = text.charAt(i);
      if (c == '"') {
        inQuote = !inQuote;
      } else if (!inQuote && c == '(') {
        depth++;
      } else if (!inQuote && c == ')') {
        depth = Math.max(0, depth - 1);
      } else if (!inQuote && depth == 0 && c == ',') {
        String rest = text.substring(i + 1, end);
        if (rest.toLowerCase(Locale.ROOT).startsWith(" and ")) {
          spans.add(new int[] {segmentStart, i});
          i += 5;
          segmentStart = i;
          continue;
        }
        if (!LEGAL_SUFFIX_AHEAD.matcher(rest).find() && !DESCRIPTOR_AHEAD.matcher(rest).find()) {
          spans.add(new int[] {segmentStart, i});
          segmentStart = i + 1;
        }
      } else if (!inQuote && depth == 0 && c == ' ' && text.startsWith(" and ", i)) {
        String before = text.substring(segmentStart, i).trim();
        if (before.endsWith(")")
            || before.endsWith("\"")
            || LEGAL_SUFFIX_BEHIND.matcher(before).find()) {
          spans.add(new int[] {segmentStart, i});
          i += 5;
          segmentStart = i;
          continue;
        }
      }
      i++;
    }
    spans.add(new int[] {segmentStart, end});

    List<ParsedParty> parties = new ArrayList<>();
    for (int[] span : spans) {
      ParsedParty party = toParty(text, span[0], span[1]);
      if (party != null) {
        parties.add(party);
      }
    }
    return parties;
  }

  private static ParsedParty toParty(String text, int rawStart, int rawEnd) {
    int start = rawStart;
    int end = rawEnd;
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start >= end) {
      return null;
    }
    String segment = text.substring(start, end);
    String label = null;
    int labelStart = -1;
    int labelEnd = -1;
    Matcher term = DEFINED_TERM.matcher(segment);
    if (term.find()) {
      label = term.group("label").trim();
      labelStart = start + term.start();
      labelEnd = start + term.end();
    }
    int paren = segment.indexOf('(');
    String name = stripTrailingCommas(paren >= 0 ? segment.substring(0, paren) : segment);
    if (name.isEmpty() || !Character.isLetterOrDigit(name.charAt(0))) {
      return null;
    }
    return new ParsedParty(segment, start, end, name, label, labelStart, labelEnd);
  }

  private static String stripTrailingCommas(String value) {
    String result = value.trim();
    while (result.endsWith(",")) {
      result = result.substring(0, result.length() - 1).trim();
    }
    return result;
  }
}
