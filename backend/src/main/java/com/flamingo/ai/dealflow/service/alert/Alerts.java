package com.flamingo.ai.dealflow.service.alert;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds unsaved alerts for each alert kind. The de-duplication key identifies the condition, so
 * raising the same condition again is a no-op.
 */
public final class Alerts {

  static final int PREAMBLE_HASH_LENGTH = 2000;
  static final int PREAMBLE_PREVIEW_LENGTH = 500;

  private Alerts() {}

  public static ProcessingAlert failedPrivateTargetExtraction(
      SourceDocument document, String preamble) {
    String text = preamble == null ? "" : preamble;
    String hashed = text.substring(0, Math.min(text.length(), PREAMBLE_HASH_LENGTH));
    return ProcessingAlert.builder()
        .kind(AlertKind.FAILED_PRIVATE_TARGET_EXTRACTION)
        .dedupKey(key(AlertKind.FAILED_PRIVATE_TARGET_EXTRACTION, document.getId()))
        .documentId(document.getId())
        .title("Could not identify merger parties in " + document.sourceReference())
        .description(
            "No party list or \"Company\" label was found in the merger agreement preamble.")
        .fieldsNeeded(fields("target_name", "acquirer_name", "agreement_date"))
        .preambleHash(Hashing.sha256().hashString(hashed, StandardCharsets.UTF_8).toString())
        .preamblePreview(text.substring(0, Math.min(text.length(), PREAMBLE_PREVIEW_LENGTH)))
        .build();
  }

  public static ProcessingAlert unparsedMaterialExhibit(SourceDocument document, String reason) {
    return ProcessingAlert.builder()
        .kind(AlertKind.UNPARSED_MATERIAL_EXHIBIT)
        .dedupKey(key(AlertKind.UNPARSED_MATERIAL_EXHIBIT, document.getId()))
        .documentId(document.getId())
        .title("Material exhibit could not be parsed: " + document.sourceReference())
        .description(
            reason
                + (document.getDescription() == null
                    ? ""
                    : " Exhibit description: " + document.getDescription()))
        .fieldsNeeded(fields("facility_type", "amount", "participants", "roles", "purpose"))
        .build();
  }

  public static ProcessingAlert lowConfidenceExtraction(SourceDocument document, AtomicFact fact) {
    return ProcessingAlert.builder()
        .kind(AlertKind.LOW_CONFIDENCE_EXTRACTION)
        .dedupKey(key(AlertKind.LOW_CONFIDENCE_EXTRACTION, document.getId()))
        .documentId(document.getId())
        .factId(fact.getId())
        .title("Party roles guessed from position in " + document.sourceReference())
        .description(
            "No defined-term label identified the target; roles were assigned by list position"
                + " (e.g. '"
                + fact.payloadValue(PayloadKeys.PARTY_NAME_DISPLAY).orElse("?")
                + "' as "
                + fact.partyRole()
                + ").")
        .fieldsNeeded(fields("target_name", "acquirer_name"))
        .build();
  }

  public static ProcessingAlert unresolvedSponsor(SourceDocument document, AtomicFact fact) {
    String name = fact.payloadValue(PayloadKeys.SPONSOR_NAME_RAW).orElse("?");
    return ProcessingAlert.builder()
        .kind(AlertKind.UNRESOLVED_SPONSOR)
        .dedupKey(key(AlertKind.UNRESOLVED_SPONSOR, fact.getId()))
        .documentId(document.getId())
        .factId(fact.getId())
        .title("Unknown sponsor entity '" + name + "'")
        .description(
            "A sponsor linkage phrase named an entity that is not in the sponsor seed list.")
        .fieldsNeeded(fields("sponsor_name"))
        .build();
  }

  public static ProcessingAlert malformedTable(SourceDocument document, int tableIndex) {
    return ProcessingAlert.builder()
        .kind(AlertKind.MALFORMED_TABLE)
        .dedupKey(key(AlertKind.MALFORMED_TABLE, document.getId(), tableIndex))
        .documentId(document.getId())
        .title("Participant table " + tableIndex + " unreadable in " + document.sourceReference())
        .description("The table mentions financing roles but no role and name columns were found.")
        .fieldsNeeded(fields("participants", "roles"))
        .build();
  }

  public static ProcessingAlert processingTimeout(SourceDocument document, String detail) {
    return ProcessingAlert.builder()
        .kind(AlertKind.PROCESSING_TIMEOUT)
        .dedupKey(key(AlertKind.PROCESSING_TIMEOUT, document.getId()))
        .documentId(document.getId())
        .title("Processing timed out for " + document.sourceReference())
        .description(detail)
        .build();
  }

  public static ProcessingAlert conflictingDealState(Deal deal, AtomicFact fact) {
    return ProcessingAlert.builder()
        .kind(AlertKind.CONFLICTING_DEAL_STATE)
        .dedupKey(key(AlertKind.CONFLICTING_DEAL_STATE, deal.getId(), fact.getId()))
        .dealId(deal.getId())
        .documentId(fact.getDocumentId())
        .factId(fact.getId())
        .title("New evidence for deal " + deal.getDealKey() + " while " + deal.getState())
        .description(
            "A "
                + fact.getKind()
                + " fact matched a deal that no longer accepts facts. Resume the deal to decide.")
        .build();
  }

  public static ProcessingAlert mergeCandidate(
      Collection<UUID> dealIds, String key, String reason) {
    List<String> ids = dealIds.stream().map(UUID::toString).sorted().toList();
    return ProcessingAlert.builder()
        .kind(AlertKind.DEAL_MERGE_CANDIDATE)
        .dedupKey(AlertKind.DEAL_MERGE_CANDIDATE + ":" + String.join(",", ids))
        .dealId(dealIds.stream().sorted().findFirst().orElse(null))
        .title("Possible duplicate deals for " + key)
        .description(reason + " Deals: " + String.join(", ", ids))
        .fieldsNeeded(fields("surviving_deal_id"))
        .build();
  }

  public static ProcessingAlert lowConfidenceMatch(
      FinancingEvent event, List<UUID> candidates, String explanation) {
    return reconciliationAlert(
        AlertKind.LOW_CONFIDENCE_MATCH,
        event,
        candidates,
        "Weak deal match for financing event",
        explanation);
  }

  public static ProcessingAlert ambiguousReconciliation(
      FinancingEvent event, List<UUID> candidates, String explanation) {
    return reconciliationAlert(
        AlertKind.AMBIGUOUS_RECONCILIATION,
        event,
        candidates,
        "Financing event matches several deals",
        explanation);
  }

  private static ProcessingAlert reconciliationAlert(
      AlertKind kind,
      FinancingEvent event,
      List<UUID> candidates,
      String title,
      String explanation) {
    return ProcessingAlert.builder()
        .kind(kind)
        .dedupKey(key(kind, event.getId()))
        .financingEventId(event.getId())
        .documentId(event.getDocumentId())
        .dealId(candidates.isEmpty() ? null : candidates.get(0))
        .title(title + " (" + event.getInstrumentType() + ")")
        .description(
            explanation
                + " Candidates: "
                + candidates.stream().map(UUID::toString).collect(Collectors.joining(", ")))
        .fieldsNeeded(fields("deal_id"))
        .build();
  }

  private static String key(AlertKind kind, Object... parts) {
    StringBuilder key = new StringBuilder(kind.name());
    for (Object part : parts) {
      key.append(':').append(part);
    }
    return key.toString();
  }

  private static List<String> fields(String... names) {
    return new ArrayList<>(List.of(names));
  }
}
