package com.flamingo.ai.dealflow.service.alert;

import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Service interface for processing alerts. */
public interface AlertService {

  /**
   * Saves an alert unless one with the same de-duplication key already exists.
   *
   * @param alert unsaved alert, usually built by {@link Alerts}
   * @return the saved alert, or empty if the condition was already recorded
   */
  Optional<ProcessingAlert> raise(ProcessingAlert alert);

  /**
   * Lists alerts, newest first.
   *
   * @param resolved resolution filter, or null for all
   * @param kind kind filter, or null for all
   * @return matching alerts
   */
  List<ProcessingAlert> list(Boolean resolved, AlertKind kind);

  /**
   * Gets an alert by ID.
   *
   * @param alertId the alert ID
   * @return the alert
   * @throws com.flamingo.ai.dealflow.exception.AlertNotFoundException if not found
   */
  ProcessingAlert get(UUID alertId);

  AlertStats stats();

  /**
   * Resolves an alert, creating the manual facts supplied with the resolution.
   *
   * @param alertId the alert ID
   * @param resolution resolver, notes and manual facts
   * @return the resolved alert
   * @throws com.flamingo.ai.dealflow.exception.AlertAlreadyResolvedException if already resolved
   */
  ProcessingAlert resolve(UUID alertId, AlertResolution resolution);
}
