package com.flamingo.ai.dealflow.api.rest;

import com.flamingo.ai.dealflow.api.dto.request.SubmitDocumentRequest;
import com.flamingo.ai.dealflow.api.dto.response.DocumentResponse;
import com.flamingo.ai.dealflow.api.dto.response.FactResponse;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.service.document.DocumentIngestionService;
import com.flamingo.ai.dealflow.service.document.DocumentSubmission;
import com.flamingo.ai.dealflow.service.fact.FactService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for submitting documents and reading their facts. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentIngestionService ingestionService;
  private final FactService factService;

  /** Submits a document given as markup or plain text. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentResponse> submitDocument(
      @Valid @RequestBody SubmitDocumentRequest request) {
    SourceDocument document = ingestionService.submit(request.toSubmission());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Uploads a document file; PDFs are converted to text. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam("accessionNumber") String accessionNumber,
      @RequestParam(value = "sequence", defaultValue = "0") String sequence,
      @RequestParam(value = "registrantIdentifier", required = false) String registrantIdentifier,
      @RequestParam(value = "registrantName", required = false) String registrantName,
      @RequestParam(value = "formType", required = false) String formType,
      @RequestParam(value = "kind", required = false) DocumentKind kind,
      @RequestParam(value = "description", required = false) String description,
      @RequestParam(value = "filedOn", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate filedOn) {
    DocumentSubmission metadata =
        new DocumentSubmission(
            accessionNumber,
            sequence,
            registrantIdentifier,
            registrantName,
            formType,
            kind,
            description,
            null,
            filedOn,
            null);
    SourceDocument document = ingestionService.upload(metadata, file);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets a document by ID. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(ingestionService.getDocument(documentId)));
  }

  /** Gets the facts extracted from a document. */
  @GetMapping("/{documentId}/facts")
  public ResponseEntity<List<FactResponse>> getFacts(@PathVariable UUID documentId) {
    List<FactResponse> facts =
        factService.getFactsForDocument(documentId).stream().map(FactResponse::fromEntity).toList();
    return ResponseEntity.ok(facts);
  }
}
