package com.flamingo.ai.dealflow.api.dto.response;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. Content is not echoed back. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String accessionNumber;
  private String sequence;
  private String registrantIdentifier;
  private String registrantName;
  private DocumentKind kind;
  private String description;
  private String mimeType;
  private LocalDate filedOn;
  private DocumentStatus status;
  private Integer normalizerVersion;
  private String processingError;
  private LocalDateTime receivedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a SourceDocument entity. */
  public static DocumentResponse fromEntity(SourceDocument document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .accessionNumber(document.getAccessionNumber())
        .sequence(document.getSequence())
        .registrantIdentifier(document.getRegistrantIdentifier())
        .registrantName(document.getRegistrantName())
        .kind(document.getKind())
        .description(document.getDescription())
        .mimeType(document.getMimeType())
        .filedOn(document.getFiledOn())
        .status(document.getStatus())
        .normalizerVersion(document.getNormalizerVersion())
        .processingError(document.getProcessingError())
        .receivedAt(document.getReceivedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
