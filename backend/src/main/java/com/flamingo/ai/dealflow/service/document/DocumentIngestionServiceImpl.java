package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.DocumentNotFoundException;
import com.flamingo.ai.dealflow.exception.DocumentProcessingException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentIngestionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

  static final String PDF = "application/pdf";

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of(PDF, "text/html", "application/xhtml+xml", "text/xml", "text/plain");

  private static final long MAX_UPLOAD_BYTES = 50L * 1024 * 1024;

  private final SourceDocumentRepository documentRepository;
  private final PdfTextExtractor pdfTextExtractor;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "document.submit", description = "Time to submit a document")
  public SourceDocument submit(DocumentSubmission submission) {
    validate(submission);

    Optional<SourceDocument> existing =
        documentRepository.findByAccessionNumberAndSequence(
            submission.accessionNumber().trim(), submission.sequence().trim());
    if (existing.isPresent()) {
      log.info(
          "Document {} already submitted as {}",
          existing.get().sourceReference(),
          existing.get().getId());
      return existing.get();
    }

    SourceDocument document =
        SourceDocument.builder()
            .accessionNumber(submission.accessionNumber().trim())
            .sequence(submission.sequence().trim())
            .registrantIdentifier(submission.registrantIdentifier())
            .registrantName(submission.registrantName())
            .kind(submission.resolvedKind())
            .description(submission.description())
            .mimeType(submission.mimeType() == null ? "text/html" : submission.mimeType())
            .filedOn(submission.filedOn())
            .rawContent(submission.content() == null ? "" : submission.content())
            .build();

    SourceDocument saved = documentRepository.save(document);
    meterRegistry.counter("document.submitted", "kind", saved.getKind().name()).increment();
    log.info(
        "Submitted {} document {} with ID: {}",
        saved.getKind(),
        saved.sourceReference(),
        saved.getId());
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "document.upload", description = "Time to upload a document")
  public SourceDocument upload(DocumentSubmission metadata, MultipartFile file) {
    if (file.isEmpty()) {
      throw new DocumentProcessingException(null, "File is empty", "Please upload a valid file");
    }
    if (file.getSize() > MAX_UPLOAD_BYTES) {
      throw new DocumentProcessingException(
          null, "File too large: " + file.getSize(), "Maximum file size is 50MB");
    }
    String contentType = file.getContentType();
    if (contentType == null || !SUPPORTED_MIME_TYPES.contains(contentType)) {
      throw new DocumentProcessingException(
          null,
          "Unsupported file type: " + contentType,
          "Supported formats: HTML, XML, PDF, plain text");
    }

    final byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Failed to read upload: " + e.getMessage(), "Failed to read file content");
    }

    String content;
    if (PDF.equals(contentType)) {
      content = pdfText(file.getOriginalFilename(), bytes);
    } else {
      content = new String(bytes, StandardCharsets.UTF_8);
    }
    return submit(metadata.withContent(content, contentType));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public SourceDocument getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  /** Unreadable PDFs are kept with empty text so material exhibits still surface as alerts. */
  private String pdfText(String fileName, byte[] bytes) {
    try {
      return pdfTextExtractor.extractText(bytes);
    } catch (IOException e) {
      log.warn("PDF text extraction failed for {}: {}", fileName, e.getMessage());
      meterRegistry.counter("document.pdf.unreadable").increment();
      return "";
    }
  }

  private static void validate(DocumentSubmission submission) {
    if (submission.accessionNumber() == null || submission.accessionNumber().isBlank()) {
      throw new IllegalArgumentException("Accession number is required");
    }
    if (submission.sequence() == null || submission.sequence().isBlank()) {
      throw new IllegalArgumentException("Document sequence is required");
    }
  }
}
