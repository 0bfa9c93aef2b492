package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.exception.DocumentProcessingException;
import com.flamingo.ai.dealflow.service.normalize.NormalizedText;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the rule set of a document's kind over its normalized text and turns the matches into
 * unattached, unsaved {@link AtomicFact}s.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactExtractionService {

  static final int MAX_SNIPPET_LENGTH = 1000;

  private final ExtractionRuleRegistry registry;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts facts from a document.
   *
   * @param document source document (id, kind, registrant and filing date are used)
   * @param text normalized text of the document
   * @return facts in rule order, de-duplicated by fingerprint
   * @throws DocumentProcessingException if a rule fails
   */
  @Timed(value = "dealflow.extraction", description = "Time to run extraction rules on a document")
  public List<AtomicFact> extract(SourceDocument document, NormalizedText text) {
    ExtractionContext context = new ExtractionContext(text, document.getKind());
    Map<String, AtomicFact> facts = new LinkedHashMap<>();
    for (ExtractionRule rule : registry.rulesFor(document.getKind())) {
      List<RuleMatch> matches;
      try {
        matches = rule.apply(context);
      } catch (RuntimeException e) {
        throw new DocumentProcessingException(
            document.getId(), "Extraction rule '" + rule.name() + "' failed", e);
      }
      for (RuleMatch match : matches) {
        AtomicFact fact = toFact(document, text, match);
        facts.putIfAbsent(fact.getFingerprint(), fact);
      }
      log.debug(
          "Rule {} produced {} matches for document {}",
          rule.name(),
          matches.size(),
          document.sourceReference());
    }
    meterRegistry
        .counter("dealflow.facts.extracted", "document_kind", document.getKind().name())
        .increment(facts.size());
    return new ArrayList<>(facts.values());
  }

  AtomicFact toFact(SourceDocument document, NormalizedText text, RuleMatch match) {
    Map<String, String> payload = withRegistrantIdentifier(document, match);
    String snippet = text.text().substring(match.start(), match.end());
    if (snippet.length() > MAX_SNIPPET_LENGTH) {
      snippet = snippet.substring(0, MAX_SNIPPET_LENGTH);
    }
    return AtomicFact.builder()
        .kind(match.kind())
        .documentId(document.getId())
        .extractionSource(match.ruleName())
        .confidence(match.confidence())
        .payload(payload)
        .evidenceStart(match.start())
        .evidenceEnd(match.end())
        .sourceStart(text.sourceStart(match.start()))
        .sourceEnd(text.sourceEnd(match.end()))
        .evidenceSnippet(snippet)
        .observedOn(document.getFiledOn())
        .fingerprint(
            FactFingerprints.automatic(
                document.getId(),
                match.ruleName(),
                match.kind(),
                match.start() + ":" + match.end(),
                payload))
        .build();
  }

  /** Party facts naming the registrant carry the registrant's canonical identifier. */
  private static Map<String, String> withRegistrantIdentifier(
      SourceDocument document, RuleMatch match) {
    Map<String, String> payload = match.payload();
    String identifier = document.getRegistrantIdentifier();
    if (!match.kind().isIdentity() || identifier == null || identifier.isBlank()) {
      return payload;
    }
    String registrant = PartyNameNormalizer.normalize(document.getRegistrantName());
    String party = payload.get(PayloadKeys.PARTY_NAME_NORMALIZED);
    if (registrant.isEmpty() || !registrant.equals(party)) {
      return payload;
    }
    Map<String, String> enriched = new HashMap<>(payload);
    enriched.put(PayloadKeys.IDENTIFIER, identifier.trim());
    return enriched;
  }
}
