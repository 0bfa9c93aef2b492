package com.flamingo.ai.dealflow.domain.repository;

import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Deal entities. */
@Repository
public interface DealRepository extends JpaRepository<Deal, UUID> {

  /** Finds a deal by its clustering key. */
  Optional<Deal> findByDealKey(String dealKey);

  /** Finds deals by acquirer identifier and normalized target name (second key tier). */
  List<Deal> findByAcquirerIdentifierAndTargetNameNormalized(
      String acquirerIdentifier, String targetNameNormalized);

  /** Finds deals by normalized party names (third key tier). */
  List<Deal> findByAcquirerNameNormalizedAndTargetNameNormalized(
      String acquirerNameNormalized, String targetNameNormalized);

  /** Finds deals in any of the given states. */
  List<Deal> findByStateInOrderByCreatedAtAsc(Collection<DealState> states);

  /** Finds deals in a state, newest first. */
  List<Deal> findByStateOrderByUpdatedAtDesc(DealState state);

  /** Finds all deals, newest first. */
  List<Deal> findAllByOrderByUpdatedAtDesc();

  /** Counts deals in a state. */
  long countByState(DealState state);
}
