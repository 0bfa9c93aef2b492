package com.flamingo.ai.dealflow.api.dto.request;

import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.fact.ManualFactInput;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one manually entered fact. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualFactRequest {

  @NotNull(message = "Kind is required")
  private FactKind kind;

  private Map<String, String> payload;

  private UUID targetDealId;

  @Size(max = 2000, message = "Note must not exceed 2000 characters")
  private String note;

  public ManualFactInput toInput() {
    return new ManualFactInput(kind, payload, targetDealId, note);
  }
}
