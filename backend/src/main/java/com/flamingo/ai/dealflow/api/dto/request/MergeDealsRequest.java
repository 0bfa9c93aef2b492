package com.flamingo.ai.dealflow.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for merging one deal into another. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeDealsRequest {

  @NotNull(message = "Surviving deal is required")
  private UUID survivorId;

  @NotNull(message = "Superseded deal is required")
  private UUID supersededId;

  @NotBlank(message = "Author is required")
  private String author;

  private String reason;
}
