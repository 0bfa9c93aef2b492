package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for AtomicFact entities. */
@Repository
public interface AtomicFactRepository extends JpaRepository<AtomicFact, UUID> {

  /** Finds facts of the given kinds that have no attachment record. */
  @Query(
      "SELECT f FROM AtomicFact f WHERE f.kind IN :kinds "
          + "AND NOT EXISTS (SELECT a FROM FactAttachment a WHERE a.factId = f.id) "
          + "ORDER BY f.observedOn ASC, f.documentId ASC, f.evidenceStart ASC, f.id ASC")
  List<AtomicFact> findUnattachedByKindIn(@Param("kinds") Collection<FactKind> kinds);

  /** Finds all facts extracted from a document. */
  List<AtomicFact> findByDocumentIdOrderByEvidenceStartAsc(UUID documentId);

  /** Finds facts of a document restricted to the given kinds. */
  List<AtomicFact> findByDocumentIdAndKindIn(UUID documentId, Collection<FactKind> kinds);

  /** Finds facts of a kind that no financing event has been built from yet. */
  @Query(
      "SELECT f FROM AtomicFact f WHERE f.kind = :kind "
          + "AND NOT EXISTS (SELECT e FROM FinancingEvent e WHERE e.sourceFactId = f.id) "
          + "ORDER BY f.observedOn ASC, f.documentId ASC, f.evidenceStart ASC, f.id ASC")
  List<AtomicFact> findWithoutFinancingEventByKind(@Param("kind") FactKind kind);

  /**
   * Returns documents holding a fact of the given kind that some financing event of the same
   * document does not yet list as a participant.
   */
  @Query(
      "SELECT DISTINCT f.documentId FROM AtomicFact f WHERE f.kind = :kind "
          + "AND EXISTS (SELECT e FROM FinancingEvent e WHERE e.documentId = f.documentId "
          + "AND NOT EXISTS (SELECT p FROM FinancingParticipant p "
          + "WHERE p.financingEventId = e.id AND p.sourceFactId = f.id))")
  List<UUID> findDocumentIdsWithUnlistedParticipants(@Param("kind") FactKind kind);

  /** Returns the fingerprints already stored for a document. */
  @Query("SELECT f.fingerprint FROM AtomicFact f WHERE f.documentId = :documentId")
  List<String> findFingerprintsByDocumentId(@Param("documentId") UUID documentId);

  /** Counts facts extracted from a document. */
  long countByDocumentId(UUID documentId);
}
