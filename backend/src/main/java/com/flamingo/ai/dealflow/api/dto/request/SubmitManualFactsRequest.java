package com.flamingo.ai.dealflow.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for manual facts entered directly against a deal. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitManualFactsRequest {

  @NotBlank(message = "Author is required")
  private String author;

  @NotEmpty(message = "At least one fact is required")
  @Valid
  private List<ManualFactRequest> facts;
}
