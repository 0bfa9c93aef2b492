package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.PartyListParser;
import com.flamingo.ai.dealflow.service.extraction.PartyListParser.ParsedParty;
import com.flamingo.ai.dealflow.service.extraction.PartyListParser.PartyList;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Emits one {@code PARTY_MENTION} per party of the preamble party list.
 *
 * <p>Labeled parties carry their defined-term role. When no party is labeled as the target, the
 * last party is proposed as target and the first as acquirer at low confidence with role source
 * {@code positional}. When only the acquirer label is missing, the first unlabeled party that is
 * not an acquisition vehicle is proposed as acquirer.
 */
@Component
@RequiredArgsConstructor
public class PartyListRule implements ExtractionRule {

  public static final String NAME = "party-list";

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    DealflowConfig.Extraction settings = config.getExtraction();
    String window = context.window(settings.getPreambleWindow());
    Optional<PartyList> found = PartyListParser.find(window);
    if (found.isEmpty()) {
      return List.of();
    }
    List<ParsedParty> parties = found.get().parties();
    Map<ParsedParty, Assignment> assignments = assignRoles(parties, settings);

    List<RuleMatch> matches = new ArrayList<>();
    for (ParsedParty party : parties) {
      Assignment assignment = assignments.get(party);
      Map<String, String> payload = new HashMap<>();
      payload.put(PayloadKeys.PARTY_NAME_RAW, party.name());
      payload.put(PayloadKeys.PARTY_NAME_DISPLAY, PartyNameNormalizer.display(party.name()));
      payload.put(PayloadKeys.PARTY_NAME_NORMALIZED, PartyNameNormalizer.normalize(party.name()));
      payload.put(PayloadKeys.ROLE, assignment.role().name());
      if (party.label() != null) {
        payload.put(PayloadKeys.ROLE_LABEL, party.label());
      }
      if (assignment.source() != null) {
        payload.put(PayloadKeys.ROLE_SOURCE, assignment.source());
      }
      matches.add(
          new RuleMatch(
              FactKind.PARTY_MENTION,
              payload,
              party.start(),
              party.end(),
              assignment.confidence(),
              NAME));
    }
    return matches;
  }

  private Map<ParsedParty, Assignment> assignRoles(
      List<ParsedParty> parties, DealflowConfig.Extraction settings) {
    Map<ParsedParty, Assignment> assignments = new HashMap<>();
    double mention = settings.getMentionConfidence();
    boolean hasTarget = false;
    boolean hasAcquirer = false;
    for (ParsedParty party : parties) {
      Optional<PartyRole> labeled = party.labeledRole();
      if (labeled.isPresent()) {
        assignments.put(
            party, new Assignment(labeled.get(), mention, PayloadKeys.ROLE_SOURCE_DEFINED_TERM));
        hasTarget |= labeled.get() == PartyRole.TARGET;
        hasAcquirer |= labeled.get() == PartyRole.ACQUIRER;
      } else if (party.isVehicle()) {
        assignments.put(
            party,
            new Assignment(
                PartyRole.ACQUISITION_VEHICLE, mention, PayloadKeys.ROLE_SOURCE_NAME));
      } else {
        assignments.put(party, new Assignment(PartyRole.UNKNOWN, mention, null));
      }
    }

    if (!hasTarget && parties.size() >= 2) {
      double positional = settings.getPositionalTargetConfidence();
      ParsedParty last = parties.get(parties.size() - 1);
      ParsedParty first = parties.get(0);
      if (assignments.get(last).role() == PartyRole.UNKNOWN) {
        assignments.put(
            last,
            new Assignment(PartyRole.TARGET, positional, PayloadKeys.ROLE_SOURCE_POSITIONAL));
      }
      if (!hasAcquirer && assignments.get(first).role() == PartyRole.UNKNOWN) {
        assignments.put(
            first,
            new Assignment(PartyRole.ACQUIRER, positional, PayloadKeys.ROLE_SOURCE_POSITIONAL));
      }
    } else if (hasTarget && !hasAcquirer) {
      parties.stream()
          .filter(p -> assignments.get(p).role() == PartyRole.UNKNOWN)
          .findFirst()
          .ifPresent(
              p ->
                  assignments.put(
                      p,
                      new Assignment(
                          PartyRole.ACQUIRER,
                          settings.getPositionalAcquirerConfidence(),
                          PayloadKeys.ROLE_SOURCE_POSITIONAL)));
    }
    return assignments;
  }

  private record Assignment(PartyRole role, double confidence, String source) {}
}
