package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import com.flamingo.ai.dealflow.service.reference.SponsorSeedList;
import com.flamingo.ai.dealflow.service.reference.SponsorSeedList.AliasMatch;
import java.util.ArrayList;
import java.util.Comparator;
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
 * Two-tier sponsor detection.
 *
 * <p>Tier one matches seed-list aliases within a radius of a sponsor keyword. Tier two captures
 * the entity named by a linkage phrase such as {@code funds managed by X}; unless X resolves
 * against the seed list it is emitted as an unresolved sponsor. A negation phrase anywhere in the
 * context window suppresses the occurrence in both tiers.
 */
@Component
@RequiredArgsConstructor
public class SponsorRule implements ExtractionRule {

  public static final String NAME = "sponsor";

  static final String TIER_SEED = "seed";
  static final String TIER_LINKAGE = "linkage";

  private static final Pattern SPONSOR_KEYWORD =
      Pattern.compile(
          "\\b(?:financial\\s+sponsors?|private\\s+equity|buyout\\s+(?:firm|fund)s?"
              + "|sponsor(?:ed|s)?)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern NEGATION =
      Pattern.compile(
          "\\b(?:not\\s+a\\s+(?:financial\\s+)?sponsor|independent\\s+of\\s+(?:any\\s+)?sponsors?"
              + "|no\\s+sponsors?|without\\s+(?:any\\s+)?sponsors?|non-sponsored)\\b",
          Pattern.CASE_INSENSITIVE);

  /** Linkage phrase followed by a capitalized entity name. */
  private static final Pattern LINKAGE =
      Pattern.compile(
          "\\b(?i:affiliates?\\s+of|funds?\\s+(?:managed|advised)\\s+by"
              + "|portfolio\\s+compan(?:y|ies)\\s+of|controlled\\s+by)\\s+(?:the\\s+)?"
              + "(?<sponsor>[A-Z][\\w&'.-]*(?:\\s+(?:[A-Z0-9][\\w&'.-]*|&|of))*)");

  private final DealflowConfig config;
  private final SponsorSeedList seedList;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    String text = context.fullText();
    int radius = config.getExtraction().getSponsorContextRadius();
    List<RuleMatch> matches = new ArrayList<>();
    Set<Integer> emittedStarts = new HashSet<>();

    Matcher keyword = SPONSOR_KEYWORD.matcher(text);
    while (keyword.find()) {
      int from = Math.max(0, keyword.start() - radius);
      int to = Math.min(text.length(), keyword.end() + radius);
      if (isNegated(text, from, to)) {
        continue;
      }
      for (AliasMatch alias : seedList.findIn(text, from, to)) {
        if (emittedStarts.add(alias.start())) {
          matches.add(
              seedMatch(
                  text.substring(alias.start(), alias.end()),
                  alias.sponsor(),
                  alias.start(),
                  alias.end(),
                  keyword.group()));
        }
      }
    }

    Matcher linkage = LINKAGE.matcher(text);
    while (linkage.find()) {
      int start = linkage.start("sponsor");
      String raw = trimEntity(linkage.group("sponsor"));
      int end = start + raw.length();
      if (raw.isEmpty() || emittedStarts.contains(start)) {
        continue;
      }
      int from = Math.max(0, linkage.start() - radius);
      int to = Math.min(text.length(), linkage.end() + radius);
      if (isNegated(text, from, to)) {
        continue;
      }
      emittedStarts.add(start);
      Optional<SponsorSeedList.Sponsor> known = seedList.resolve(raw);
      if (known.isPresent()) {
        matches.add(seedMatch(raw, known.get(), start, end, null));
      } else {
        matches.add(unresolvedMatch(raw, start, end));
      }
    }
    matches.sort(Comparator.comparingInt(RuleMatch::start));
    return matches;
  }

  private RuleMatch seedMatch(
      String raw, SponsorSeedList.Sponsor sponsor, int start, int end, String keyword) {
    Map<String, String> payload = new HashMap<>();
    payload.put(PayloadKeys.SPONSOR_NAME_RAW, raw);
    payload.put(PayloadKeys.SPONSOR_NAME_DISPLAY, sponsor.name());
    payload.put(PayloadKeys.SPONSOR_NAME_NORMALIZED, sponsor.normalizedName());
    payload.put(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "false");
    payload.put(PayloadKeys.MATCH_TIER, keyword != null ? TIER_SEED : TIER_LINKAGE);
    if (keyword != null) {
      payload.put(PayloadKeys.KEYWORD, keyword);
    }
    return new RuleMatch(
        FactKind.SPONSOR_MENTION,
        payload,
        start,
        end,
        config.getExtraction().getSeedSponsorConfidence(),
        NAME);
  }

  private RuleMatch unresolvedMatch(String raw, int start, int end) {
    return new RuleMatch(
        FactKind.SPONSOR_MENTION,
        Map.of(
            PayloadKeys.SPONSOR_NAME_RAW, raw,
            PayloadKeys.SPONSOR_NAME_DISPLAY, PartyNameNormalizer.display(raw),
            PayloadKeys.SPONSOR_NAME_NORMALIZED, PartyNameNormalizer.normalize(raw),
            PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "true",
            PayloadKeys.MATCH_TIER, TIER_LINKAGE),
        start,
        end,
        config.getExtraction().getLinkageSponsorConfidence(),
        NAME);
  }

  private static boolean isNegated(String text, int from, int to) {
    Matcher negation = NEGATION.matcher(text);
    negation.region(from, to);
    return negation.find();
  }

  /** Drops a trailing connective or sentence period captured with the entity name. */
  private static String trimEntity(String entity) {
    String value = entity.trim();
    boolean changed = true;
    while (changed && !value.isEmpty()) {
      changed = false;
      if (value.endsWith(" of") || value.endsWith(" &")) {
        value = value.substring(0, value.length() - 2).trim();
        changed = true;
      } else if (value.endsWith(",") || value.endsWith("'") || value.endsWith("-")) {
        value = value.substring(0, value.length() - 1).trim();
        changed = true;
      } else if (value.endsWith(".") && !endsWithAbbreviation(value)) {
        value = value.substring(0, value.length() - 1).trim();
        changed = true;
      }
    }
    return value;
  }

  private static boolean endsWithAbbreviation(String value) {
    return value.matches("(?s).*\\b(?:Inc|Corp|Co|Ltd|L\\.P|L\\.L\\.C|LLC|N\\.A)\\.$");
  }
}
