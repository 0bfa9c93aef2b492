package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for ProcessingAlert entities. */
@Repository
public interface ProcessingAlertRepository extends JpaRepository<ProcessingAlert, UUID> {

  boolean existsByDedupKey(String dedupKey);

  List<ProcessingAlert> findAllByOrderByCreatedAtDesc();

  List<ProcessingAlert> findByResolvedOrderByCreatedAtDesc(boolean resolved);

  List<ProcessingAlert> findByResolvedAndKindOrderByCreatedAtDesc(boolean resolved, AlertKind kind);

  List<ProcessingAlert> findByKindOrderByCreatedAtDesc(AlertKind kind);

  List<ProcessingAlert> findByDocumentId(UUID documentId);

  /** Finds open alerts of a kind raised against a deal. */
  List<ProcessingAlert> findByDealIdAndKindAndResolvedFalse(UUID dealId, AlertKind kind);

  /** Counts unresolved alerts grouped by kind. */
  @Query(
      "SELECT a.kind, COUNT(a) FROM ProcessingAlert a WHERE a.resolved = false GROUP BY a.kind")
  List<Object[]> countUnresolvedByKind();

  long countByResolved(boolean resolved);
}
