package com.flamingo.ai.dealflow.api.dto.request;

import com.flamingo.ai.dealflow.service.alert.AlertResolution;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for resolving an alert, optionally with manual facts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {

  @NotBlank(message = "Resolver is required")
  private String resolvedBy;

  @Size(max = 2000, message = "Notes must not exceed 2000 characters")
  private String notes;

  @Valid @Builder.Default private List<ManualFactRequest> facts = new ArrayList<>();

  public AlertResolution toResolution() {
    List<ManualFactRequest> requested = facts == null ? List.of() : facts;
    return new AlertResolution(
        resolvedBy, notes, requested.stream().map(ManualFactRequest::toInput).toList());
  }
}
