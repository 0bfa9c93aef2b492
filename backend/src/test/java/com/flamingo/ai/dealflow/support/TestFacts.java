package com.flamingo.ai.dealflow.support;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/** Builders for facts as the extraction stages would store them. */
public final class TestFacts {

  private TestFacts() {}

  public static AtomicFact.AtomicFactBuilder base(
      FactKind kind, UUID documentId, LocalDate observedOn, int start) {
    return AtomicFact.builder()
        .id(UUID.randomUUID())
        .kind(kind)
        .documentId(documentId)
        .extractionSource("test")
        .observedOn(observedOn)
        .evidenceStart(start)
        .evidenceEnd(start + 10)
        .evidenceSnippet("evidence")
        .fingerprint(UUID.randomUUID().toString());
  }

  public static AtomicFact party(
      UUID documentId,
      LocalDate observedOn,
      int start,
      PartyRole role,
      String normalizedName,
      double confidence) {
    return party(documentId, observedOn, start, role, normalizedName, confidence, null);
  }

  public static AtomicFact party(
      UUID documentId,
      LocalDate observedOn,
      int start,
      PartyRole role,
      String normalizedName,
      double confidence,
      String identifier) {
    Map<String, String> payload = new HashMap<>();
    payload.put(PayloadKeys.PARTY_NAME_RAW, capitalize(normalizedName) + " Inc.");
    payload.put(PayloadKeys.PARTY_NAME_DISPLAY, capitalize(normalizedName) + " Inc");
    payload.put(PayloadKeys.PARTY_NAME_NORMALIZED, normalizedName);
    payload.put(PayloadKeys.ROLE, role.name());
    if (identifier != null) {
      payload.put(PayloadKeys.IDENTIFIER, identifier);
    }
    return base(FactKind.PARTY_DEFINITION, documentId, observedOn, start)
        .confidence(confidence)
        .payload(payload)
        .build();
  }

  public static AtomicFact date(UUID documentId, LocalDate observedOn, int start, String date) {
    return base(FactKind.DEAL_DATE, documentId, observedOn, start)
        .confidence(0.95)
        .payload(Map.of(PayloadKeys.DATE, date, PayloadKeys.DATE_TYPE, "AGREEMENT"))
        .build();
  }

  public static AtomicFact dealValue(
      UUID documentId, LocalDate observedOn, int start, String amount) {
    return base(FactKind.CURRENCY_AMOUNT, documentId, observedOn, start)
        .confidence(0.8)
        .payload(
            Map.of(
                PayloadKeys.AMOUNT, amount,
                PayloadKeys.CURRENCY, "USD",
                PayloadKeys.AMOUNT_CONTEXT, PayloadKeys.AMOUNT_CONTEXT_DEAL_VALUE))
        .build();
  }

  public static AtomicFact sponsor(
      UUID documentId, LocalDate observedOn, int start, String normalizedName, double confidence) {
    return base(FactKind.SPONSOR_MENTION, documentId, observedOn, start)
        .confidence(confidence)
        .payload(
            Map.of(
                PayloadKeys.SPONSOR_NAME_RAW, capitalize(normalizedName),
                PayloadKeys.SPONSOR_NAME_DISPLAY, capitalize(normalizedName),
                PayloadKeys.SPONSOR_NAME_NORMALIZED, normalizedName,
                PayloadKeys.UNRESOLVED_SPONSOR_ENTITY, "false"))
        .build();
  }

  public static AtomicFact financing(
      UUID documentId, LocalDate observedOn, int start, Map<String, String> payload) {
    return base(FactKind.FINANCING_MENTION, documentId, observedOn, start)
        .confidence(0.8)
        .payload(payload)
        .build();
  }

  public static AtomicFact tableRole(
      UUID documentId, LocalDate observedOn, int row, String institution, String role) {
    return base(FactKind.TABLE_ROLE, documentId, observedOn, 0)
        .evidenceStart(null)
        .evidenceEnd(null)
        .tableCoordinates("t0:r" + row + ":c0")
        .confidence(0.8)
        .payload(
            Map.of(
                PayloadKeys.INSTITUTION_NAME_RAW, institution,
                PayloadKeys.INSTITUTION_NAME_NORMALIZED,
                PartyNameNormalizer.normalize(institution),
                PayloadKeys.ROLE, role,
                PayloadKeys.TABLE_INDEX, "0",
                PayloadKeys.ROW, String.valueOf(row),
                PayloadKeys.COLUMN, "0"))
        .build();
  }

  /** A reviewer's fact aimed at a deal. */
  public static AtomicFact manualParty(UUID dealId, PartyRole role, String normalizedName) {
    return AtomicFact.builder()
        .id(UUID.randomUUID())
        .kind(FactKind.PARTY_DEFINITION)
        .provenance(FactProvenance.MANUAL)
        .extractionSource("manual")
        .confidence(1.0)
        .payload(
            Map.of(
                PayloadKeys.PARTY_NAME_RAW, capitalize(normalizedName),
                PayloadKeys.PARTY_NAME_DISPLAY, capitalize(normalizedName),
                PayloadKeys.PARTY_NAME_NORMALIZED, normalizedName,
                PayloadKeys.ROLE, role.name()))
        .targetDealId(dealId)
        .enteredBy("analyst")
        .fingerprint("manual:" + UUID.randomUUID())
        .build();
  }

  private static String capitalize(String value) {
    return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
