package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.ReconciliationStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a financing event, its link to a deal and its participants. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancingEventResponse {

  private UUID id;
  private UUID sourceFactId;
  private UUID documentId;
  private InstrumentFamily instrumentFamily;
  private String instrumentType;
  private MarketTag marketTag;
  private BigDecimal amount;
  private String interestRate;
  private Integer maturityYear;
  private String purpose;
  private String issuerIdentifier;
  private UUID dealId;
  private ReconciliationStatus reconciliationStatus;
  private Double reconciliationConfidence;
  private String reconciliationExplanation;
  private List<String> candidateDealIds;
  private BigDecimal modeledFee;
  private List<ParticipantResponse> participants;
  private LocalDateTime createdAt;
  private LocalDateTime reconciledAt;

  public static FinancingEventResponse fromEntity(
      FinancingEvent event, List<ParticipantResponse> participants) {
    return FinancingEventResponse.builder()
        .id(event.getId())
        .sourceFactId(event.getSourceFactId())
        .documentId(event.getDocumentId())
        .instrumentFamily(event.getInstrumentFamily())
        .instrumentType(event.getInstrumentType())
        .marketTag(event.getMarketTag())
        .amount(event.getAmount())
        .interestRate(event.getInterestRate())
        .maturityYear(event.getMaturityYear())
        .purpose(event.getPurpose())
        .issuerIdentifier(event.getIssuerIdentifier())
        .dealId(event.getDealId())
        .reconciliationStatus(event.getReconciliationStatus())
        .reconciliationConfidence(event.getReconciliationConfidence())
        .reconciliationExplanation(event.getReconciliationExplanation())
        .candidateDealIds(List.copyOf(event.getCandidateDealIds()))
        .modeledFee(event.getModeledFee())
        .participants(participants)
        .createdAt(event.getCreatedAt())
        .reconciledAt(event.getReconciledAt())
        .build();
  }
}
