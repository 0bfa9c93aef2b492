package com.flamingo.ai.dealflow.api.rest;

import com.flamingo.ai.dealflow.api.dto.request.ResolveAlertRequest;
import com.flamingo.ai.dealflow.api.dto.response.AlertResponse;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import com.flamingo.ai.dealflow.service.alert.AlertService;
import com.flamingo.ai.dealflow.service.alert.AlertStats;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the review queue. */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

  private final AlertService alertService;

  /** Lists alerts, newest first. */
  @GetMapping
  public ResponseEntity<List<AlertResponse>> listAlerts(
      @RequestParam(value = "resolved", required = false) Boolean resolved,
      @RequestParam(value = "kind", required = false) AlertKind kind) {
    return ResponseEntity.ok(
        alertService.list(resolved, kind).stream().map(AlertResponse::fromEntity).toList());
  }

  @GetMapping("/stats")
  public ResponseEntity<AlertStats> stats() {
    return ResponseEntity.ok(alertService.stats());
  }

  @GetMapping("/{alertId}")
  public ResponseEntity<AlertResponse> getAlert(@PathVariable UUID alertId) {
    return ResponseEntity.ok(AlertResponse.fromEntity(alertService.get(alertId)));
  }

  /** Resolves an alert, creating any manual facts supplied with the resolution. */
  @PostMapping("/{alertId}/resolve")
  public ResponseEntity<AlertResponse> resolve(
      @PathVariable UUID alertId, @Valid @RequestBody ResolveAlertRequest request) {
    return ResponseEntity.ok(
        AlertResponse.fromEntity(alertService.resolve(alertId, request.toResolution())));
  }
}
