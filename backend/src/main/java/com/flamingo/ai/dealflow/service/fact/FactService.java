package com.flamingo.ai.dealflow.service.fact;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import java.util.List;
import java.util.UUID;

/** Service interface for reading facts and entering manual facts. */
public interface FactService {

  /**
   * Gets the facts extracted from a document, in evidence order.
   *
   * @param documentId the document ID
   * @return facts of the document
   * @throws com.flamingo.ai.dealflow.exception.DocumentNotFoundException if not found
   */
  List<AtomicFact> getFactsForDocument(UUID documentId);

  /**
   * Gets the facts currently attached to a deal.
   *
   * @param dealId the deal ID
   * @return attached facts, oldest observation first
   * @throws com.flamingo.ai.dealflow.exception.DealNotFoundException if not found
   */
  List<AtomicFact> getFactsForDeal(UUID dealId);

  /**
   * Creates a manual fact. The fact is left unattached; the next clustering or reconciliation
   * pass consumes it.
   *
   * @param input the reviewer's fact
   * @param author reviewer identity
   * @param documentId document the fact belongs to, or null
   * @param sourceAlertId alert being resolved, or null
   * @return the saved fact
   * @throws IllegalArgumentException if the payload is incomplete for the fact kind
   */
  AtomicFact createManualFact(
      ManualFactInput input, String author, UUID documentId, UUID sourceAlertId);

  /**
   * Creates manual facts aimed at a deal.
   *
   * @param dealId the deal ID
   * @param author reviewer identity
   * @param inputs the facts; a missing target deal defaults to {@code dealId}
   * @return the saved facts
   */
  List<AtomicFact> submitManualFacts(UUID dealId, String author, List<ManualFactInput> inputs);
}
