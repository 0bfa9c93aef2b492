package com.flamingo.ai.dealflow.service.reference;

import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable list of known financial sponsors and their aliases.
 *
 * <p>Loaded once at startup by {@link SponsorSeedListLoader}; never mutated afterwards.
 */
public final class SponsorSeedList {

  /** Words that may follow a sponsor alias without changing the entity. */
  private static final Set<String> GENERIC_TOKENS =
      Set.of(
          "partners", "capital", "group", "management", "global", "equity", "fund", "funds",
          "holdings", "international", "advisors", "advisers", "asset", "lp", "l", "p", "llc",
          "the", "private", "investments", "co");

  /**
   * A known sponsor.
   *
   * @param name display name
   * @param aliases lower-case aliases matched in text
   */
  public record Sponsor(String name, List<String> aliases) {

    public Sponsor {
      aliases = List.copyOf(aliases);
    }

    /** Comparison key of the sponsor. */
    public String normalizedName() {
      return PartyNameNormalizer.normalize(name);
    }
  }

  /**
   * An alias occurrence in text.
   *
   * @param sponsor matched sponsor
   * @param start inclusive start offset
   * @param end exclusive end offset
   */
  public record AliasMatch(Sponsor sponsor, int start, int end) {}

  private record CompiledAlias(Sponsor sponsor, String normalized, Pattern pattern) {}

  private final List<Sponsor> sponsors;
  private final List<CompiledAlias> aliases;

  public SponsorSeedList(List<Sponsor> sponsors) {
    this.sponsors = List.copyOf(sponsors);
    List<CompiledAlias> compiled = new ArrayList<>();
    for (Sponsor sponsor : this.sponsors) {
      for (String alias : sponsor.aliases()) {
        compiled.add(
            new CompiledAlias(
                sponsor,
                PartyNameNormalizer.normalize(alias),
                Pattern.compile(
                    "(?<![\\p{L}\\p{N}])" + Pattern.quote(alias) + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
      }
    }
    compiled.sort(Comparator.comparingInt((CompiledAlias a) -> a.normalized().length()).reversed());
    this.aliases = List.copyOf(compiled);
  }

  public List<Sponsor> sponsors() {
    return sponsors;
  }

  public int size() {
    return sponsors.size();
  }

  /**
   * Finds alias occurrences in {@code text[from, to)}. Overlapping occurrences resolve to the
   * longest alias.
   */
  public List<AliasMatch> findIn(String text, int from, int to) {
    int start = Math.max(0, from);
    int end = Math.min(text.length(), to);
    if (start >= end) {
      return List.of();
    }
    List<AliasMatch> found = new ArrayList<>();
    boolean[] taken = new boolean[end - start];
    for (CompiledAlias alias : aliases) {
      Matcher matcher = alias.pattern().matcher(text);
      matcher.region(start, end);
      while (matcher.find()) {
        if (isFree(taken, matcher.start() - start, matcher.end() - start)) {
          Arrays.fill(taken, matcher.start() - start, matcher.end() - start, true);
          found.add(new AliasMatch(alias.sponsor(), matcher.start(), matcher.end()));
        }
      }
    }
    found.sort(Comparator.comparingInt(AliasMatch::start));
    return found;
  }

  /**
   * Resolves a free-form sponsor name against the list: the normalized name equals an alias, or
   * an alias followed only by generic words such as {@code Partners} or {@code Capital}.
   */
  public Optional<Sponsor> resolve(String name) {
    String normalized = PartyNameNormalizer.normalize(name);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    for (CompiledAlias alias : aliases) {
      if (normalized.equals(alias.normalized())
          || normalized.equals(alias.sponsor().normalizedName())) {
        return Optional.of(alias.sponsor());
      }
      if (normalized.startsWith(alias.normalized() + " ")
          && onlyGenericTokens(normalized.substring(alias.normalized().length() + 1))) {
        return Optional.of(alias.sponsor());
      }
    }
    return Optional.empty();
  }

  private static boolean onlyGenericTokens(String remainder) {
    for (String token : remainder.trim().split("\\s+")) {
      if (!GENERIC_TOKENS.contains(token)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isFree(boolean[] taken, int from, int to) {
    for (int i = from; i < to; i++) {
      if (taken[i]) {
        return false;
      }
    }
    return true;
  }
}
