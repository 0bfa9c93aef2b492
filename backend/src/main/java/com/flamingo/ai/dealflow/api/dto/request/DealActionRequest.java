package com.flamingo.ai.dealflow.api.dto.request;

import com.flamingo.ai.dealflow.domain.enums.DealState;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a reviewer's lifecycle action on a deal. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealActionRequest {

  @NotBlank(message = "Actor is required")
  private String actor;

  /** Target state when resuming; ignored by lock and close. */
  private DealState resumeTo;
}
