package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.DealMergeRecord;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a deal merge audit record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRecordResponse {

  private UUID id;
  private UUID survivingDealId;
  private UUID supersededDealId;
  private String supersededDealKey;
  private int reassignedFactCount;
  private int reassignedEventCount;
  private String mergedBy;
  private String reason;
  private LocalDateTime mergedAt;

  public static MergeRecordResponse fromEntity(DealMergeRecord record) {
    return MergeRecordResponse.builder()
        .id(record.getId())
        .survivingDealId(record.getSurvivingDealId())
        .supersededDealId(record.getSupersededDealId())
        .supersededDealKey(record.getSupersededDealKey())
        .reassignedFactCount(record.getReassignedFactCount())
        .reassignedEventCount(record.getReassignedEventCount())
        .mergedBy(record.getMergedBy())
        .reason(record.getReason())
        .mergedAt(record.getMergedAt())
        .build();
  }
}
