package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for accepting documents from the document supplier. */
public interface DocumentIngestionService {

  /**
   * Stores a document for processing. Submitting the same accession number and sequence again
   * returns the stored document unchanged.
   *
   * @param submission the document
   * @return the stored document
   */
  SourceDocument submit(DocumentSubmission submission);

  /**
   * Stores an uploaded file. PDF files are converted to text first; a PDF without a readable text
   * layer is stored with empty content.
   *
   * @param metadata document metadata; its content and content type are ignored
   * @param file the uploaded file
   * @return the stored document
   */
  SourceDocument upload(DocumentSubmission metadata, MultipartFile file);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ai.dealflow.exception.DocumentNotFoundException if not found
   */
  SourceDocument getDocument(UUID documentId);
}
