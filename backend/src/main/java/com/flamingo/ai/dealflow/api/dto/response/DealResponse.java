package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a deal and its derived tags and fees. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealResponse {

  private UUID id;
  private String dealKey;
  private ClusteringKeyTier keyTier;
  private DealState state;
  private String reviewReason;
  private String conflictReason;
  private String acquirerIdentifier;
  private String acquirerName;
  private Double acquirerConfidence;
  private String targetIdentifier;
  private String targetName;
  private Double targetConfidence;
  private String sponsorName;
  private Double sponsorConfidence;
  private Boolean sponsorUnresolved;
  private LocalDate agreementDate;
  private BigDecimal dealValue;
  private SponsorBacking sponsorBacking;
  private MarketTag marketTag;
  private BigDecimal advisoryFeeEstimate;
  private BigDecimal underwritingFeeEstimate;
  private UUID mergedIntoDealId;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime promotedAt;

  public static DealResponse fromEntity(Deal deal) {
    return DealResponse.builder()
        .id(deal.getId())
        .dealKey(deal.getDealKey())
        .keyTier(deal.getKeyTier())
        .state(deal.getState())
        .reviewReason(deal.getReviewReason())
        .conflictReason(deal.getConflictReason())
        .acquirerIdentifier(deal.getAcquirerIdentifier())
        .acquirerName(deal.getAcquirerNameDisplay())
        .acquirerConfidence(deal.getAcquirerConfidence())
        .targetIdentifier(deal.getTargetIdentifier())
        .targetName(deal.getTargetNameDisplay())
        .targetConfidence(deal.getTargetConfidence())
        .sponsorName(deal.getSponsorNameDisplay())
        .sponsorConfidence(deal.getSponsorConfidence())
        .sponsorUnresolved(deal.getSponsorUnresolved())
        .agreementDate(deal.getAgreementDate())
        .dealValue(deal.getDealValue())
        .sponsorBacking(deal.getSponsorBacking())
        .marketTag(deal.getMarketTag())
        .advisoryFeeEstimate(deal.getAdvisoryFeeEstimate())
        .underwritingFeeEstimate(deal.getUnderwritingFeeEstimate())
        .mergedIntoDealId(deal.getMergedIntoDealId())
        .createdAt(deal.getCreatedAt())
        .updatedAt(deal.getUpdatedAt())
        .promotedAt(deal.getPromotedAt())
        .build();
  }
}
