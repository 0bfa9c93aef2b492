package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import java.time.LocalDate;

/**
 * A document handed over by the document supplier.
 *
 * @param accessionNumber registry accession number of the filing
 * @param sequence exhibit sequence or file name; {@code 0} for the primary document
 * @param registrantIdentifier CIK of the filer, if known
 * @param registrantName filer name, if known
 * @param formType form or exhibit type such as {@code 8-K} or {@code EX-2.1}
 * @param kind explicit document kind; derived from {@code formType} when null
 * @param description exhibit description from the filing index
 * @param mimeType content type of {@code content}
 * @param filedOn filing date
 * @param content raw markup or plain text
 */
public record DocumentSubmission(
    String accessionNumber,
    String sequence,
    String registrantIdentifier,
    String registrantName,
    String formType,
    DocumentKind kind,
    String description,
    String mimeType,
    LocalDate filedOn,
    String content) {

  /** Document kind, falling back to the form type mapping. */
  public DocumentKind resolvedKind() {
    return kind != null ? kind : DocumentKind.fromFormType(formType);
  }

  /** Returns a copy carrying different content and content type. */
  public DocumentSubmission withContent(String newContent, String newMimeType) {
    return new DocumentSubmission(
        accessionNumber,
        sequence,
        registrantIdentifier,
        registrantName,
        formType,
        kind,
        description,
        newMimeType,
        filedOn,
        newContent);
  }
}
