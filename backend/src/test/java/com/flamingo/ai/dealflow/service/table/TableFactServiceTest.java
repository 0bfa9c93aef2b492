package com.flamingo.ai.dealflow.service.table;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.normalize.TextNormalizer;
import com.flamingo.ai.dealflow.service.table.TableFactService.TableExtraction;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TableFactServiceTest {

  private static final String PARTICIPANTS =
      "<html><body><p>Underwriting</p><table>"
          + "<tr><th>Institution</th><th>Role</th></tr>"
          + "<tr><td>Goldman Sachs &amp; Co. LLC</td><td>Joint Bookrunner</td></tr>"
          + "<tr><td>Wells Fargo Securities, LLC</td><td>Co-Manager</td></tr>"
          + "</table><table><tr><td>Joint Bookrunners</td></tr></table></body></html>";

  private TableFactService service;

  @BeforeEach
  void setUp() {
    DealflowConfig config = new DealflowConfig();
    service =
        new TableFactService(
            new TableGridBuilder(new TextNormalizer()), new TableInterpreter(config), config);
  }

  private static SourceDocument document(String content, String mimeType) {
    return SourceDocument.builder()
        .id(UUID.randomUUID())
        .accessionNumber("0000950103-24-000010")
        .sequence("1")
        .kind(DocumentKind.CURRENT_REPORT)
        .mimeType(mimeType)
        .rawContent(content)
        .build();
  }

  @Test
  @DisplayName("Should emit one table role fact per participant row")
  void shouldEmitTableRoleFacts() {
    // Given
    SourceDocument document = document(PARTICIPANTS, "text/html");

    // When
    TableExtraction extraction = service.extract(document);

    // Then
    assertThat(extraction.facts()).hasSize(2);
    AtomicFact first = extraction.facts().get(0);
    assertThat(first.getKind()).isEqualTo(FactKind.TABLE_ROLE);
    assertThat(first.getDocumentId()).isEqualTo(document.getId());
    assertThat(first.getTableCoordinates()).isEqualTo("t0:r1:c0");
    assertThat(first.getConfidence()).isEqualTo(0.8);
    assertThat(first.getEvidenceSnippet()).isEqualTo("Goldman Sachs & Co. LLC | Joint Bookrunner");
    assertThat(first.getPayload())
        .containsEntry(PayloadKeys.ROLE, "Joint Bookrunner")
        .containsEntry(PayloadKeys.INSTITUTION_NAME_RAW, "Goldman Sachs & Co. LLC")
        .containsEntry(PayloadKeys.TABLE_INDEX, "0");
    assertThat(extraction.facts().get(1).getPayload())
        .containsEntry(PayloadKeys.ROLE, "Co-Manager");
  }

  @Test
  @DisplayName("Should report relevant tables it could not read")
  void shouldReportFailedTables() {
    // When
    TableExtraction extraction = service.extract(document(PARTICIPANTS, "text/html"));

    // Then
    assertThat(extraction.failedTables()).containsExactly(1);
  }

  @Test
  @DisplayName("Should produce the same fingerprints on every run")
  void shouldProduceStableFingerprints() {
    // Given
    SourceDocument document = document(PARTICIPANTS, "text/html");

    // When
    TableExtraction first = service.extract(document);
    TableExtraction second = service.extract(document);

    // Then
    assertThat(second.facts())
        .extracting(AtomicFact::getFingerprint)
        .containsExactlyElementsOf(
            first.facts().stream().map(AtomicFact::getFingerprint).toList());
  }

  @Test
  @DisplayName("Should skip documents that are not markup")
  void shouldSkipPlainText() {
    // When
    TableExtraction extraction =
        service.extract(document("Plain text with no tables.", "application/pdf"));

    // Then
    assertThat(extraction.facts()).isEmpty();
    assertThat(extraction.failedTables()).isEmpty();
  }
}
