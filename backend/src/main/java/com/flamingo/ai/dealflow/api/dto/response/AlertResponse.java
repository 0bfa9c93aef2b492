package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a processing alert. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {

  private UUID id;
  private AlertKind kind;
  private UUID documentId;
  private UUID dealId;
  private UUID factId;
  private UUID financingEventId;
  private String title;
  private String description;
  private List<String> fieldsNeeded;
  private String preamblePreview;
  private boolean resolved;
  private LocalDateTime resolvedAt;
  private String resolvedBy;
  private String resolutionNotes;
  private List<String> resolutionFactIds;
  private LocalDateTime createdAt;

  public static AlertResponse fromEntity(ProcessingAlert alert) {
    return AlertResponse.builder()
        .id(alert.getId())
        .kind(alert.getKind())
        .documentId(alert.getDocumentId())
        .dealId(alert.getDealId())
        .factId(alert.getFactId())
        .financingEventId(alert.getFinancingEventId())
        .title(alert.getTitle())
        .description(alert.getDescription())
        .fieldsNeeded(List.copyOf(alert.getFieldsNeeded()))
        .preamblePreview(alert.getPreamblePreview())
        .resolved(alert.isResolved())
        .resolvedAt(alert.getResolvedAt())
        .resolvedBy(alert.getResolvedBy())
        .resolutionNotes(alert.getResolutionNotes())
        .resolutionFactIds(List.copyOf(alert.getResolutionFactIds()))
        .createdAt(alert.getCreatedAt())
        .build();
  }
}
