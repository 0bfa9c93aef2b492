package com.flamingo.ai.dealflow.service.alert;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import com.flamingo.ai.dealflow.domain.repository.ProcessingAlertRepository;
import com.flamingo.ai.dealflow.exception.AlertAlreadyResolvedException;
import com.flamingo.ai.dealflow.exception.AlertNotFoundException;
import com.flamingo.ai.dealflow.service.fact.FactService;
import com.flamingo.ai.dealflow.service.fact.ManualFactInput;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the AlertService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertServiceImpl implements AlertService {

  private final ProcessingAlertRepository alertRepository;
  private final FactService factService;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public Optional<ProcessingAlert> raise(ProcessingAlert alert) {
    if (alertRepository.existsByDedupKey(alert.getDedupKey())) {
      log.debug("Alert {} already recorded", alert.getDedupKey());
      return Optional.empty();
    }
    ProcessingAlert saved = alertRepository.save(alert);
    meterRegistry.counter("dealflow.alerts.raised", "kind", alert.getKind().name()).increment();
    log.info("Raised {} alert {}: {}", saved.getKind(), saved.getId(), saved.getTitle());
    return Optional.of(saved);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "alert.list", description = "Time to list alerts")
  public List<ProcessingAlert> list(Boolean resolved, AlertKind kind) {
    if (resolved != null && kind != null) {
      return alertRepository.findByResolvedAndKindOrderByCreatedAtDesc(resolved, kind);
    }
    if (resolved != null) {
      return alertRepository.findByResolvedOrderByCreatedAtDesc(resolved);
    }
    if (kind != null) {
      return alertRepository.findByKindOrderByCreatedAtDesc(kind);
    }
    return alertRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  public ProcessingAlert get(UUID alertId) {
    return alertRepository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "alert.stats", description = "Time to compute alert statistics")
  public AlertStats stats() {
    Map<AlertKind, Long> byKind = new EnumMap<>(AlertKind.class);
    for (Object[] row : alertRepository.countUnresolvedByKind()) {
      byKind.put((AlertKind) row[0], ((Number) row[1]).longValue());
    }
    return new AlertStats(alertRepository.count(), alertRepository.countByResolved(false), byKind);
  }

  @Override
  @Transactional
  @Timed(value = "alert.resolve", description = "Time to resolve an alert")
  public ProcessingAlert resolve(UUID alertId, AlertResolution resolution) {
    ProcessingAlert alert = get(alertId);
    if (alert.isResolved()) {
      throw new AlertAlreadyResolvedException(alertId);
    }
    if (resolution.resolvedBy() == null || resolution.resolvedBy().isBlank()) {
      throw new IllegalArgumentException("Resolver identity is required");
    }

    List<UUID> factIds = new ArrayList<>();
    for (ManualFactInput input : resolution.facts()) {
      ManualFactInput aimed =
          input.targetDealId() != null || alert.getDealId() == null
              ? input
              : new ManualFactInput(
                  input.kind(), input.payload(), alert.getDealId(), input.note());
      AtomicFact fact =
          factService.createManualFact(
              aimed, resolution.resolvedBy(), alert.getDocumentId(), alert.getId());
      factIds.add(fact.getId());
    }

    alert.resolve(resolution.resolvedBy(), resolution.notes(), factIds);
    ProcessingAlert saved = alertRepository.save(alert);
    meterRegistry.counter("dealflow.alerts.resolved", "kind", alert.getKind().name()).increment();
    log.info(
        "Alert {} ({}) resolved by {} with {} manual facts",
        alertId,
        alert.getKind(),
        resolution.resolvedBy(),
        factIds.size());
    return saved;
  }
}
