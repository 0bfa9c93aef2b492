package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for SourceDocument entities. */
@Repository
public interface SourceDocumentRepository extends JpaRepository<SourceDocument, UUID> {

  /** Finds a document by its source identifier pair. */
  Optional<SourceDocument> findByAccessionNumberAndSequence(
      String accessionNumber, String sequence);

  /** Finds documents awaiting processing, oldest filing first. */
  List<SourceDocument> findByStatusInOrderByFiledOnAscReceivedAtAsc(
      Collection<DocumentStatus> statuses);

  /** Finds all documents of a filing. */
  List<SourceDocument> findByAccessionNumber(String accessionNumber);

  /** Counts documents in a status. */
  long countByStatus(DocumentStatus status);
}
