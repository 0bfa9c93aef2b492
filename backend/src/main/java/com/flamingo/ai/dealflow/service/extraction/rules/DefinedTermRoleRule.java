package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.PartyListParser;
import com.flamingo.ai.dealflow.service.extraction.PartyListParser.ParsedParty;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.extraction.RoleLabels;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.util.ArrayList;
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
 * Emits {@code PARTY_DEFINITION} facts for recognized defined-term labels such as {@code (the
 * "Company")} that directly follow a party name.
 */
@Component
@RequiredArgsConstructor
public class DefinedTermRoleRule implements ExtractionRule {

  public static final String NAME = "defined-term-role";

  /** Where the name preceding a label can start when it is not part of a party list. */
  private static final Pattern NAME_BOUNDARY =
      Pattern.compile(
          "(?:\\n|;|\\.\\s+(?=[A-Z])|\\b(?i:among|between|with|by|and)\\s)");

  private static final int MAX_NAME_LENGTH = 150;

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    DealflowConfig.Extraction settings = config.getExtraction();
    String window = context.window(settings.getPreambleWindow());
    List<ParsedParty> listed =
        PartyListParser.find(window).map(PartyListParser.PartyList::parties).orElse(List.of());

    List<RuleMatch> matches = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    Matcher term = PartyListParser.DEFINED_TERM.matcher(window);
    while (term.find()) {
      String label = term.group("label").trim();
      Optional<PartyRole> role = RoleLabels.roleFor(label);
      if (role.isEmpty()) {
        continue;
      }
      Optional<NameSpan> name = listedName(listed, term.start());
      if (name.isEmpty()) {
        name = precedingName(window, term.start());
      }
      if (name.isEmpty()) {
        continue;
      }
      String normalized = PartyNameNormalizer.normalize(name.get().text());
      if (normalized.isEmpty() || !seen.add(role.get() + "|" + normalized)) {
        continue;
      }
      matches.add(
          new RuleMatch(
              FactKind.PARTY_DEFINITION,
              Map.of(
                  PayloadKeys.PARTY_NAME_RAW, name.get().text(),
                  PayloadKeys.PARTY_NAME_DISPLAY, PartyNameNormalizer.display(name.get().text()),
                  PayloadKeys.PARTY_NAME_NORMALIZED, normalized,
                  PayloadKeys.ROLE, role.get().name(),
                  PayloadKeys.ROLE_LABEL, label,
                  PayloadKeys.ROLE_SOURCE, PayloadKeys.ROLE_SOURCE_DEFINED_TERM),
              name.get().start(),
              term.end(),
              settings.getDefinedTermConfidence(),
              NAME));
    }
    return matches;
  }

  private static Optional<NameSpan> listedName(List<ParsedParty> parties, int labelStart) {
    return parties.stream()
        .filter(p -> p.labelStart() == labelStart)
        .findFirst()
        .map(p -> new NameSpan(p.name(), p.start()));
  }

  /** Capitalized name immediately before a label outside the party list. */
  private static Optional<NameSpan> precedingName(String text, int labelStart) {
    int from = Math.max(0, labelStart - MAX_NAME_LENGTH);
    String before = text.substring(from, labelStart);
    Matcher boundary = NAME_BOUNDARY.matcher(before);
    int nameStart = 0;
    while (boundary.find()) {
      nameStart = boundary.end();
    }
    String candidate = before.substring(nameStart);
    int leading = candidate.length() - candidate.stripLeading().length();
    String name = candidate.strip();
    while (name.endsWith(",")) {
      name = name.substring(0, name.length() - 1).strip();
    }
    if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) {
      return Optional.empty();
    }
    return Optional.of(new NameSpan(name, from + nameStart + leading));
  }

  private record NameSpan(String text, int start) {}
}
