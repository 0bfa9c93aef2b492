package com.flamingo.ai.dealflow.service.deal;

import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.DealMergeRecord;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import java.util.List;
import java.util.UUID;

/** Service interface for deal queries and lifecycle actions. */
public interface DealService {

  /**
   * Gets a deal by ID.
   *
   * @param dealId the deal ID
   * @return the deal
   * @throws com.flamingo.ai.dealflow.exception.DealNotFoundException if not found
   */
  Deal getDeal(UUID dealId);

  /**
   * Gets a deal by clustering key, following merge pointers.
   *
   * @param dealKey the clustering key
   * @return the deal currently owning the key
   * @throws com.flamingo.ai.dealflow.exception.DealNotFoundException if not found
   */
  Deal getDealByKey(String dealKey);

  /**
   * Lists deals, most recently updated first.
   *
   * @param state state filter, or null for all
   * @return matching deals
   */
  List<Deal> listDeals(DealState state);

  List<FinancingEvent> getFinancingEvents(UUID dealId);

  List<FinancingParticipant> getParticipants(UUID financingEventId);

  List<DealMergeRecord> getMergeHistory(UUID dealId);

  /**
   * Merges one active deal into another. Attachments and linked financing events move to the
   * survivor; the superseded deal is closed and points at the survivor.
   *
   * @param survivorId deal that remains
   * @param supersededId deal that is folded in
   * @param author reviewer identity
   * @param reason free-text reason
   * @return the audit record
   * @throws com.flamingo.ai.dealflow.exception.InvalidDealStateException if either deal is not
   *     CANDIDATE or OPEN
   */
  DealMergeRecord merge(UUID survivorId, UUID supersededId, String author, String reason);

  Deal lock(UUID dealId, String actor);

  Deal close(UUID dealId, String actor);

  /**
   * Resumes a deal held for review. Resuming to CLOSED or LOCKED dismisses the facts that sent the
   * deal to review; resuming to an active state lets the next clustering pass attach them.
   *
   * @param dealId the deal ID
   * @param resumeTo target state, or null for the state held before review
   * @param actor reviewer identity
   * @return the resumed deal
   */
  Deal resume(UUID dealId, DealState resumeTo, String actor);

  /**
   * Sets a fact aside so clustering no longer considers it.
   *
   * @param factId the fact ID
   * @param reviewer reviewer identity
   * @param reason free-text reason
   * @return the attachment record in its dismissed state
   */
  FactAttachment dismissFact(UUID factId, String reviewer, String reason);
}
