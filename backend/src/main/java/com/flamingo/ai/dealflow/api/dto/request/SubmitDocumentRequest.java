package com.flamingo.ai.dealflow.api.dto.request;

import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.service.document.DocumentSubmission;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for submitting a document as markup or plain text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitDocumentRequest {

  @NotBlank(message = "Accession number is required")
  @Size(max = 64, message = "Accession number must not exceed 64 characters")
  private String accessionNumber;

  @Builder.Default private String sequence = "0";

  private String registrantIdentifier;
  private String registrantName;
  private String formType;
  private DocumentKind kind;
  private String description;

  @Builder.Default private String mimeType = "text/html";

  private LocalDate filedOn;

  @NotNull(message = "Content is required")
  private String content;

  /** Converts the request into a service-level submission. */
  public DocumentSubmission toSubmission() {
    return new DocumentSubmission(
        accessionNumber,
        sequence,
        registrantIdentifier,
        registrantName,
        formType,
        kind,
        description,
        mimeType,
        filedOn,
        content);
  }
}
