package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.FinancingParticipant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for FinancingParticipant entities. */
@Repository
public interface FinancingParticipantRepository extends JpaRepository<FinancingParticipant, UUID> {

  List<FinancingParticipant> findByFinancingEventId(UUID financingEventId);

  boolean existsByFinancingEventIdAndSourceFactId(UUID financingEventId, UUID sourceFactId);
}
