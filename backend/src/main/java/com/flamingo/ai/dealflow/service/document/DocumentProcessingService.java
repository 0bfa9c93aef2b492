package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import com.flamingo.ai.dealflow.exception.DocumentNotFoundException;
import com.flamingo.ai.dealflow.exception.DocumentProcessingException;
import com.flamingo.ai.dealflow.service.alert.AlertService;
import com.flamingo.ai.dealflow.service.alert.Alerts;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRuleRegistry;
import com.flamingo.ai.dealflow.service.extraction.FactExtractionService;
import com.flamingo.ai.dealflow.service.normalize.NormalizedText;
import com.flamingo.ai.dealflow.service.normalize.TextNormalizer;
import com.flamingo.ai.dealflow.service.table.TableFactService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Normalizes one document, runs the pattern rules and the table interpreter over it, stores the
 * new facts and raises the extraction alerts. Extraction runs outside any transaction; only the
 * write of its results is transactional.
 */
@Service
@Slf4j
public class DocumentProcessingService {

  private final SourceDocumentRepository documentRepository;
  private final AtomicFactRepository factRepository;
  private final TextNormalizer textNormalizer;
  private final FactExtractionService extractionService;
  private final TableFactService tableFactService;
  private final MaterialExhibits materialExhibits;
  private final AlertService alertService;
  private final DealflowConfig config;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public DocumentProcessingService(
      SourceDocumentRepository documentRepository,
      AtomicFactRepository factRepository,
      TextNormalizer textNormalizer,
      FactExtractionService extractionService,
      TableFactService tableFactService,
      MaterialExhibits materialExhibits,
      AlertService alertService,
      DealflowConfig config,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.documentRepository = documentRepository;
    this.factRepository = factRepository;
    this.textNormalizer = textNormalizer;
    this.extractionService = extractionService;
    this.tableFactService = tableFactService;
    this.materialExhibits = materialExhibits;
    this.alertService = alertService;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Processes a document. Extraction failures mark the document {@code FAILED} and are not
   * rethrown; re-processing an extracted document stores nothing new.
   *
   * @param documentId the document ID
   * @return what the run stored and raised
   * @throws DocumentNotFoundException if the document does not exist
   */
  @Timed(value = "document.process", description = "Time to process a document")
  public DocumentOutcome process(UUID documentId) {
    SourceDocument document =
        transactionTemplate.execute(
            status -> {
              SourceDocument doc = load(documentId);
              doc.startProcessing();
              return documentRepository.save(doc);
            });

    NormalizedText text = normalize(document);
    List<AtomicFact> extracted;
    List<Integer> failedTables;
    try {
      extracted = new ArrayList<>(extractionService.extract(document, text));
      TableFactService.TableExtraction tables = tableFactService.extract(document);
      extracted.addAll(tables.facts());
      failedTables = tables.failedTables();
    } catch (DocumentProcessingException e) {
      log.error("Extraction failed for {}: {}", document.sourceReference(), e.getMessage(), e);
      markFailed(documentId, e.getMessage());
      meterRegistry.counter("document.processing.failed", "reason", "extraction").increment();
      return new DocumentOutcome(documentId, DocumentStatus.FAILED, 0, 0);
    }

    DocumentOutcome outcome =
        transactionTemplate.execute(status -> store(documentId, text, extracted, failedTables));
    log.info(
        "Processed {} ({}): {} new facts, {} new alerts",
        document.sourceReference(),
        document.getKind(),
        outcome.newFacts(),
        outcome.alertsRaised());
    return outcome;
  }

  /**
   * Marks a document that exceeded its processing budget as failed and raises a timeout alert.
   *
   * @param documentId the document ID
   * @param budget the budget that was exceeded
   */
  public void markTimedOut(UUID documentId, Duration budget) {
    String detail = "Processing exceeded " + budget.toSeconds() + "s";
    transactionTemplate.executeWithoutResult(
        status -> {
          SourceDocument document = load(documentId);
          document.markFailed(detail);
          documentRepository.save(document);
          alertService.raise(Alerts.processingTimeout(document, detail));
        });
    meterRegistry.counter("document.processing.failed", "reason", "timeout").increment();
    log.warn("Document {} timed out after {}", documentId, budget);
  }

  /** Marks a document as failed without raising an alert. */
  public void markFailed(UUID documentId, String error) {
    transactionTemplate.executeWithoutResult(
        status -> {
          SourceDocument document = load(documentId);
          document.markFailed(error);
          documentRepository.save(document);
        });
  }

  NormalizedText normalize(SourceDocument document) {
    String raw = document.getRawContent() == null ? "" : document.getRawContent();
    return TableFactService.isMarkup(document)
        ? textNormalizer.normalize(raw)
        : textNormalizer.normalizePlainText(raw);
  }

  private DocumentOutcome store(
      UUID documentId,
      NormalizedText text,
      List<AtomicFact> extracted,
      List<Integer> failedTables) {
    SourceDocument document = load(documentId);
    if (document.getStatus() != DocumentStatus.PROCESSING) {
      // timed out and marked failed while extracting
      log.warn(
          "Discarding late extraction of {}: document is {}",
          document.sourceReference(),
          document.getStatus());
      return new DocumentOutcome(documentId, document.getStatus(), 0, 0);
    }
    int version = config.getNormalizer().getVersion();
    if (document.needsNormalization(version)) {
      document.applyNormalization(text.text(), version);
    }

    Set<String> known = new HashSet<>(factRepository.findFingerprintsByDocumentId(documentId));
    List<AtomicFact> fresh =
        extracted.stream().filter(fact -> known.add(fact.getFingerprint())).toList();
    factRepository.saveAll(fresh);

    List<AtomicFact> facts = factRepository.findByDocumentIdOrderByEvidenceStartAsc(documentId);
    int raised = 0;
    for (ProcessingAlert alert : alertsFor(document, text, facts, failedTables)) {
      if (alertService.raise(alert).isPresent()) {
        raised++;
      }
    }

    document.markExtracted();
    documentRepository.save(document);
    meterRegistry.counter("document.processed", "kind", document.getKind().name()).increment();
    return new DocumentOutcome(documentId, DocumentStatus.EXTRACTED, fresh.size(), raised);
  }

  List<ProcessingAlert> alertsFor(
      SourceDocument document,
      NormalizedText text,
      List<AtomicFact> facts,
      List<Integer> failedTables) {
    List<ProcessingAlert> alerts = new ArrayList<>();
    boolean material = materialExhibits.isMaterial(document);

    if (material && (text.isBlank() || materialExhibits.isPoorText(text.wordCount()))) {
      alerts.add(
          Alerts.unparsedMaterialExhibit(
              document,
              text.isBlank()
                  ? "No text could be extracted."
                  : "Only " + text.wordCount() + " words could be extracted."));
    }

    if (ExtractionRuleRegistry.requiresPartyList(document.getKind())
        && !hasPartyListOrCompanyLabel(facts)) {
      alerts.add(
          Alerts.failedPrivateTargetExtraction(
              document, text.prefix(config.getExtraction().getPreambleWindow())));
    }

    facts.stream()
        .filter(fact -> fact.getKind() == FactKind.PARTY_MENTION)
        .filter(
            fact ->
                PayloadKeys.ROLE_SOURCE_POSITIONAL.equals(
                    fact.getPayload().get(PayloadKeys.ROLE_SOURCE)))
        .findFirst()
        .ifPresent(fact -> alerts.add(Alerts.lowConfidenceExtraction(document, fact)));

    facts.stream()
        .filter(fact -> fact.getKind() == FactKind.SPONSOR_MENTION)
        .filter(
            fact ->
                Boolean.parseBoolean(fact.getPayload().get(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY)))
        .forEach(fact -> alerts.add(Alerts.unresolvedSponsor(document, fact)));

    if (material || document.getKind() == DocumentKind.MATERIAL_CONTRACT) {
      failedTables.forEach(index -> alerts.add(Alerts.malformedTable(document, index)));
    }
    return alerts;
  }

  private static boolean hasPartyListOrCompanyLabel(List<AtomicFact> facts) {
    return facts.stream()
        .anyMatch(
            fact ->
                fact.getKind() == FactKind.PARTY_MENTION
                    || (fact.getKind() == FactKind.PARTY_DEFINITION
                        && fact.partyRole() == PartyRole.TARGET));
  }

  private SourceDocument load(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }
}
