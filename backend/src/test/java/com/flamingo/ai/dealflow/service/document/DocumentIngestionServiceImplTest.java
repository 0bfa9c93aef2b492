package com.flamingo.ai.dealflow.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.DocumentNotFoundException;
import com.flamingo.ai.dealflow.exception.DocumentProcessingException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentIngestionServiceImplTest {

  private static final String ACCESSION = "0001193125-24-000001";

  @Mock private SourceDocumentRepository documentRepository;

  @Mock private PdfTextExtractor pdfTextExtractor;

  @Mock private MeterRegistry meterRegistry;

  @Mock private Counter counter;

  private DocumentIngestionServiceImpl ingestionService;

  @BeforeEach
  void setUp() {
    ingestionService =
        new DocumentIngestionServiceImpl(documentRepository, pdfTextExtractor, meterRegistry);

    when(meterRegistry.counter(any(String.class), any(String.class), any(String.class)))
        .thenReturn(counter);
    when(meterRegistry.counter(any(String.class))).thenReturn(counter);
    when(documentRepository.findByAccessionNumberAndSequence(any(), any()))
        .thenReturn(Optional.empty());
    when(documentRepository.save(any(SourceDocument.class)))
        .thenAnswer(
            i -> {
              SourceDocument document = i.getArgument(0);
              document.setId(UUID.randomUUID());
              return document;
            });
  }

  private static DocumentSubmission submission(String formType, String content) {
    return new DocumentSubmission(
        " " + ACCESSION + " ",
        "EX-2.1",
        "0000123456",
        "Acme Holdings, Inc.",
        formType,
        null,
        "Agreement and Plan of Merger",
        null,
        LocalDate.of(2024, 6, 3),
        content);
  }

  @Test
  void shouldStoreSubmittedDocument_withKindFromFormType() {
    // When
    SourceDocument result = ingestionService.submit(submission("EX-2.1", "<p>merger</p>"));

    // Then
    assertThat(result.getId()).isNotNull();
    assertThat(result.getAccessionNumber()).isEqualTo(ACCESSION);
    assertThat(result.getKind()).isEqualTo(DocumentKind.MERGER_AGREEMENT);
    assertThat(result.getMimeType()).isEqualTo("text/html");
    assertThat(result.getStatus()).isEqualTo(DocumentStatus.PENDING);
    assertThat(result.getRawContent()).isEqualTo("<p>merger</p>");
    verify(counter).increment();
  }

  @Test
  void shouldReturnStoredDocument_whenSubmittedAgain() {
    // Given
    SourceDocument existing =
        SourceDocument.builder()
            .id(UUID.randomUUID())
            .accessionNumber(ACCESSION)
            .sequence("EX-2.1")
            .kind(DocumentKind.MERGER_AGREEMENT)
            .build();
    when(documentRepository.findByAccessionNumberAndSequence(ACCESSION, "EX-2.1"))
        .thenReturn(Optional.of(existing));

    // When
    SourceDocument result = ingestionService.submit(submission("EX-2.1", "changed"));

    // Then
    assertThat(result).isSameAs(existing);
    verify(documentRepository, never()).save(any());
  }

  @Test
  void shouldRejectSubmission_withoutAccessionNumber() {
    DocumentSubmission missing =
        new DocumentSubmission(
            " ", "EX-2.1", null, null, "EX-2.1", null, null, null, null, "text");

    assertThatThrownBy(() -> ingestionService.submit(missing))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Accession number");
  }

  @Test
  void shouldUploadHtml_asUtf8Text() {
    // Given
    MultipartFile file =
        new MockMultipartFile(
            "file",
            "ex21.htm",
            "text/html",
            "<p>Acme Holdings, Inc. (“Parent”)</p>".getBytes(StandardCharsets.UTF_8));

    // When
    SourceDocument result = ingestionService.upload(submission("EX-2.1", null), file);

    // Then
    assertThat(result.getRawContent()).isEqualTo("<p>Acme Holdings, Inc. (“Parent”)</p>");
    assertThat(result.getMimeType()).isEqualTo("text/html");
  }

  @Test
  void shouldUploadPdf_usingExtractedText() throws IOException {
    // Given
    MultipartFile file =
        new MockMultipartFile("file", "ex101.pdf", "application/pdf", "PDF content".getBytes());
    when(pdfTextExtractor.extractText(any())).thenReturn("CREDIT AGREEMENT dated as of");

    // When
    SourceDocument result = ingestionService.upload(submission("EX-10.1", null), file);

    // Then
    assertThat(result.getRawContent()).isEqualTo("CREDIT AGREEMENT dated as of");
    assertThat(result.getMimeType()).isEqualTo("application/pdf");
    assertThat(result.getKind()).isEqualTo(DocumentKind.MATERIAL_CONTRACT);
  }

  @Test
  void shouldStoreEmptyText_whenPdfUnreadable() throws IOException {
    // Given
    MultipartFile file =
        new MockMultipartFile("file", "scan.pdf", "application/pdf", "garbage".getBytes());
    when(pdfTextExtractor.extractText(any())).thenThrow(new IOException("not a PDF"));
    ArgumentCaptor<SourceDocument> captor = ArgumentCaptor.forClass(SourceDocument.class);

    // When
    ingestionService.upload(submission("EX-10.1", null), file);

    // Then
    verify(documentRepository).save(captor.capture());
    assertThat(captor.getValue().getRawContent()).isEmpty();
    verify(meterRegistry).counter("document.pdf.unreadable");
  }

  @Test
  void shouldThrowException_whenFileIsEmpty() {
    MultipartFile file = new MockMultipartFile("file", "empty.htm", "text/html", new byte[0]);

    assertThatThrownBy(() -> ingestionService.upload(submission("EX-2.1", null), file))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void shouldThrowException_whenUnsupportedFileType() {
    MultipartFile file =
        new MockMultipartFile("file", "deal.docx", "application/msword", "content".getBytes());

    assertThatThrownBy(() -> ingestionService.upload(submission("EX-2.1", null), file))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("Unsupported file type");
  }

  @Test
  void shouldThrowException_whenDocumentNotFound() {
    UUID documentId = UUID.randomUUID();
    when(documentRepository.findById(documentId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> ingestionService.getDocument(documentId))
        .isInstanceOf(DocumentNotFoundException.class);
  }
}
