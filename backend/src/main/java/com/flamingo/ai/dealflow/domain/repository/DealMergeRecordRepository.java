package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.DealMergeRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for deal merge audit records. */
@Repository
public interface DealMergeRecordRepository extends JpaRepository<DealMergeRecord, UUID> {

  List<DealMergeRecord> findBySurvivingDealIdOrderByMergedAtAsc(UUID survivingDealId);
}
