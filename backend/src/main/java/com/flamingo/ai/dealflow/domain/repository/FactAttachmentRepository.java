package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for fact-to-deal attachment records. */
@Repository
public interface FactAttachmentRepository extends JpaRepository<FactAttachment, UUID> {

  Optional<FactAttachment> findByFactId(UUID factId);

  List<FactAttachment> findByFactIdIn(Collection<UUID> factIds);

  /** Finds all attachments owned by a deal. */
  List<FactAttachment> findByDealId(UUID dealId);

  /** Finds attachments of facts from a document. */
  List<FactAttachment> findByDocumentId(UUID documentId);

  boolean existsByFactId(UUID factId);
}
