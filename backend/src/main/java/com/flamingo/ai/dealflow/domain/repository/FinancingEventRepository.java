package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.enums.ReconciliationStatus;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for FinancingEvent entities. */
@Repository
public interface FinancingEventRepository extends JpaRepository<FinancingEvent, UUID> {

  /** Finds events still awaiting a deal link. */
  List<FinancingEvent> findByReconciliationStatusInOrderByCreatedAtAsc(
      Collection<ReconciliationStatus> statuses);

  List<FinancingEvent> findByDealId(UUID dealId);

  List<FinancingEvent> findByDocumentId(UUID documentId);

  /** Counts financing events with a reconciliation status. */
  long countByReconciliationStatus(ReconciliationStatus status);
}
