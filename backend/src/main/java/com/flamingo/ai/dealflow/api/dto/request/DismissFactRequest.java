package com.flamingo.ai.dealflow.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for setting a fact aside. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DismissFactRequest {

  @NotBlank(message = "Reviewer is required")
  private String reviewer;

  private String reason;
}
