package com.flamingo.ai.dealflow.service.table;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.FactFingerprints;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Turns participant tables of a markup document into {@code TABLE_ROLE} facts. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableFactService {

  public static final String SOURCE = "table-interpreter";

  private final TableGridBuilder gridBuilder;
  private final TableInterpreter interpreter;
  private final DealflowConfig config;

  /**
   * Outcome of reading a document's tables.
   *
   * @param facts unsaved table facts
   * @param failedTables indexes of tables that mention financing roles but could not be read
   */
  public record TableExtraction(List<AtomicFact> facts, List<Integer> failedTables) {}

  public TableExtraction extract(SourceDocument document) {
    if (!isMarkup(document)) {
      return new TableExtraction(List.of(), List.of());
    }
    List<AtomicFact> facts = new ArrayList<>();
    List<Integer> failed = new ArrayList<>();
    for (TableGrid grid : gridBuilder.build(document.getRawContent())) {
      TableInterpreter.Interpretation interpretation = interpreter.interpret(grid);
      if (interpretation.failed()) {
        failed.add(grid.index());
        continue;
      }
      for (TableInterpreter.ParticipantRow row : interpretation.rows()) {
        facts.add(toFact(document, grid, row));
      }
    }
    if (!facts.isEmpty() || !failed.isEmpty()) {
      log.debug(
          "Document {}: {} table facts, {} unreadable participant tables",
          document.sourceReference(),
          facts.size(),
          failed.size());
    }
    return new TableExtraction(facts, failed);
  }

  private AtomicFact toFact(
      SourceDocument document, TableGrid grid, TableInterpreter.ParticipantRow row) {
    String coordinates = "t" + grid.index() + ":r" + row.row() + ":c" + row.nameColumn();
    Map<String, String> payload =
        Map.of(
            PayloadKeys.INSTITUTION_NAME_RAW, row.institution(),
            PayloadKeys.INSTITUTION_NAME_NORMALIZED,
                PartyNameNormalizer.normalize(row.institution()),
            PayloadKeys.ROLE, row.role(),
            PayloadKeys.TABLE_INDEX, String.valueOf(grid.index()),
            PayloadKeys.ROW, String.valueOf(row.row()),
            PayloadKeys.COLUMN, String.valueOf(row.nameColumn()));
    double confidence =
        row.fromHeader()
            ? config.getExtraction().getMentionConfidence()
            : config.getTable().getRoleConfidence();
    return AtomicFact.builder()
        .kind(FactKind.TABLE_ROLE)
        .documentId(document.getId())
        .extractionSource(SOURCE)
        .confidence(confidence)
        .payload(payload)
        .tableCoordinates(coordinates)
        .evidenceSnippet(grid.rowText(row.row()))
        .observedOn(document.getFiledOn())
        .fingerprint(
            FactFingerprints.automatic(
                document.getId(), SOURCE, FactKind.TABLE_ROLE, coordinates, payload))
        .build();
  }

  /** Whether the raw content is HTML or XML markup rather than extracted plain text. */
  public static boolean isMarkup(SourceDocument document) {
    String content = document.getRawContent();
    if (content == null || content.isBlank()) {
      return false;
    }
    String mime = document.getMimeType() == null ? "" : document.getMimeType();
    mime = mime.toLowerCase(Locale.ROOT);
    return mime.contains("html") || mime.contains("xml") || content.contains("<table");
  }
}
