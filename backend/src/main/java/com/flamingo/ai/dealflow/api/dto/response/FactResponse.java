package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an atomic fact with its evidence span. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactResponse {

  private UUID id;
  private FactKind kind;
  private UUID documentId;
  private FactProvenance provenance;
  private String extractionSource;
  private double confidence;
  private Map<String, String> payload;
  private Integer evidenceStart;
  private Integer evidenceEnd;
  private Integer sourceStart;
  private Integer sourceEnd;
  private String tableCoordinates;
  private String evidenceSnippet;
  private LocalDate observedOn;
  private UUID targetDealId;
  private UUID sourceAlertId;
  private String enteredBy;
  private String note;
  private LocalDateTime createdAt;

  public static FactResponse fromEntity(AtomicFact fact) {
    return FactResponse.builder()
        .id(fact.getId())
        .kind(fact.getKind())
        .documentId(fact.getDocumentId())
        .provenance(fact.getProvenance())
        .extractionSource(fact.getExtractionSource())
        .confidence(fact.getConfidence())
        .payload(fact.getPayload())
        .evidenceStart(fact.getEvidenceStart())
        .evidenceEnd(fact.getEvidenceEnd())
        .sourceStart(fact.getSourceStart())
        .sourceEnd(fact.getSourceEnd())
        .tableCoordinates(fact.getTableCoordinates())
        .evidenceSnippet(fact.getEvidenceSnippet())
        .observedOn(fact.getObservedOn())
        .targetDealId(fact.getTargetDealId())
        .sourceAlertId(fact.getSourceAlertId())
        .enteredBy(fact.getEnteredBy())
        .note(fact.getNote())
        .createdAt(fact.getCreatedAt())
        .build();
  }
}
