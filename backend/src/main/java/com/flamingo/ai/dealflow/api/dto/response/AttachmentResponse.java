package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.enums.AttachmentDisposition;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a fact's attachment record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentResponse {

  private UUID factId;
  private UUID dealId;
  private AttachmentDisposition disposition;
  private String attachedBy;
  private String note;
  private LocalDateTime attachedAt;

  public static AttachmentResponse fromEntity(FactAttachment attachment) {
    return AttachmentResponse.builder()
        .factId(attachment.getFactId())
        .dealId(attachment.getDealId())
        .disposition(attachment.getDisposition())
        .attachedBy(attachment.getAttachedBy())
        .note(attachment.getNote())
        .attachedAt(attachment.getAttachedAt())
        .build();
  }
}
