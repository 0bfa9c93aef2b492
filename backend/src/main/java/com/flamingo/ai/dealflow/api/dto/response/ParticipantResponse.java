package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an institution taking part in a financing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantResponse {

  private UUID id;
  private UUID sourceFactId;
  private String institutionName;
  private String role;
  private String roleNormalized;
  private Double roleWeight;
  private BigDecimal estimatedFee;
  private String tableCoordinates;

  public static ParticipantResponse fromEntity(FinancingParticipant participant) {
    return ParticipantResponse.builder()
        .id(participant.getId())
        .sourceFactId(participant.getSourceFactId())
        .institutionName(participant.getInstitutionNameRaw())
        .role(participant.getRole())
        .roleNormalized(participant.getRoleNormalized())
        .roleWeight(participant.getRoleWeight())
        .estimatedFee(participant.getEstimatedFee())
        .tableCoordinates(participant.getTableCoordinates())
        .build();
  }
}
