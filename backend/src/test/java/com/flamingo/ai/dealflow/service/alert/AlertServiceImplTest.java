package com.flamingo.ai.dealflow.service.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.entity.ProcessingAlert;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import com.flamingo.ai.dealflow.domain.repository.ProcessingAlertRepository;
import com.flamingo.ai.dealflow.exception.AlertAlreadyResolvedException;
import com.flamingo.ai.dealflow.exception.AlertNotFoundException;
import com.flamingo.ai.dealflow.service.fact.FactService;
import com.flamingo.ai.dealflow.service.fact.ManualFactInput;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AlertServiceImplTest {

  @Mock private ProcessingAlertRepository alertRepository;
  @Mock private FactService factService;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private AlertServiceImpl alertService;
  private SourceDocument document;

  @BeforeEach
  void setUp() {
    alertService = new AlertServiceImpl(alertRepository, factService, meterRegistry);
    document =
        SourceDocument.builder()
            .id(UUID.randomUUID())
            .accessionNumber("0001193125-24-000001")
            .sequence("EX-2.1")
            .kind(DocumentKind.MERGER_AGREEMENT)
            .mimeType("text/html")
            .build();

    when(meterRegistry.counter(anyString(), anyString(), anyString())).thenReturn(counter);
    when(alertRepository.save(any(ProcessingAlert.class)))
        .thenAnswer(
            i -> {
              ProcessingAlert alert = i.getArgument(0);
              if (alert.getId() == null) {
                alert.setId(UUID.randomUUID());
              }
              return alert;
            });
  }

  @Nested
  @DisplayName("Raising alerts")
  class Raising {

    @Test
    @DisplayName("Should save a new alert with preamble hash and preview")
    void shouldSaveNewAlert() {
      // Given
      String preamble = "AGREEMENT AND PLAN OF MERGER ".repeat(100);
      ProcessingAlert alert = Alerts.failedPrivateTargetExtraction(document, preamble);
      when(alertRepository.existsByDedupKey(alert.getDedupKey())).thenReturn(false);

      // When
      Optional<ProcessingAlert> saved = alertService.raise(alert);

      // Then
      assertThat(saved).isPresent();
      assertThat(saved.get().getKind()).isEqualTo(AlertKind.FAILED_PRIVATE_TARGET_EXTRACTION);
      assertThat(saved.get().getPreambleHash()).hasSize(64);
      assertThat(saved.get().getPreamblePreview()).hasSize(Alerts.PREAMBLE_PREVIEW_LENGTH);
      assertThat(saved.get().getFieldsNeeded()).contains("target_name", "acquirer_name");
      verify(counter).increment();
    }

    @Test
    @DisplayName("Should not record the same condition twice")
    void shouldDeduplicate() {
      // Given
      ProcessingAlert alert = Alerts.failedPrivateTargetExtraction(document, "preamble");
      when(alertRepository.existsByDedupKey(alert.getDedupKey())).thenReturn(true);

      // When
      Optional<ProcessingAlert> saved = alertService.raise(alert);

      // Then
      assertThat(saved).isEmpty();
      verify(alertRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should give the same condition the same key")
    void shouldKeyByCondition() {
      assertThat(Alerts.failedPrivateTargetExtraction(document, "a").getDedupKey())
          .isEqualTo(Alerts.failedPrivateTargetExtraction(document, "b").getDedupKey());
      assertThat(Alerts.unparsedMaterialExhibit(document, "empty").getDedupKey())
          .isNotEqualTo(Alerts.failedPrivateTargetExtraction(document, "a").getDedupKey());
    }
  }

  @Nested
  @DisplayName("Resolving alerts")
  class Resolving {

    private ProcessingAlert open;

    @BeforeEach
    void setUpAlert() {
      open = Alerts.failedPrivateTargetExtraction(document, "preamble");
      open.setId(UUID.randomUUID());
      when(alertRepository.findById(open.getId())).thenReturn(Optional.of(open));
    }

    @Test
    @DisplayName("Should create manual facts tied to the alert's document")
    void shouldCreateManualFacts() {
      // Given
      ManualFactInput target =
          new ManualFactInput(
              FactKind.PARTY_DEFINITION,
              Map.of(PayloadKeys.PARTY_NAME_RAW, "Beta Corp.", PayloadKeys.ROLE, "TARGET"),
              null,
              "from the signature page");
      AtomicFact created = AtomicFact.builder().id(UUID.randomUUID()).build();
      when(factService.createManualFact(any(), eq("analyst"), any(), any())).thenReturn(created);

      // When
      ProcessingAlert resolved =
          alertService.resolve(
              open.getId(), new AlertResolution("analyst", "checked", List.of(target)));

      // Then
      assertThat(resolved.isResolved()).isTrue();
      assertThat(resolved.getResolvedBy()).isEqualTo("analyst");
      assertThat(resolved.getResolutionFactIds()).containsExactly(created.getId().toString());
      verify(factService).createManualFact(target, "analyst", document.getId(), open.getId());
    }

    @Test
    @DisplayName("Should aim facts at the alert's deal when they name none")
    void shouldAimFactsAtAlertDeal() {
      // Given
      UUID dealId = UUID.randomUUID();
      open.setDealId(dealId);
      ManualFactInput input =
          new ManualFactInput(
              FactKind.PARTY_DEFINITION,
              Map.of(PayloadKeys.PARTY_NAME_RAW, "Beta Corp.", PayloadKeys.ROLE, "TARGET"),
              null,
              null);
      when(factService.createManualFact(any(), any(), any(), any()))
          .thenReturn(AtomicFact.builder().id(UUID.randomUUID()).build());
      ArgumentCaptor<ManualFactInput> captor = ArgumentCaptor.forClass(ManualFactInput.class);

      // When
      alertService.resolve(open.getId(), new AlertResolution("analyst", null, List.of(input)));

      // Then
      verify(factService).createManualFact(captor.capture(), any(), any(), any());
      assertThat(captor.getValue().targetDealId()).isEqualTo(dealId);
      assertThat(captor.getValue().payload())
          .containsEntry(PayloadKeys.ROLE, PartyRole.TARGET.name());
    }

    @Test
    @DisplayName("Should refuse to resolve an alert twice")
    void shouldRefuseSecondResolution() {
      // Given
      open.resolve("analyst", "done", List.of());

      // When / Then
      assertThatThrownBy(
              () -> alertService.resolve(open.getId(), new AlertResolution("other", null, null)))
          .isInstanceOf(AlertAlreadyResolvedException.class);
    }

    @Test
    @DisplayName("Should require a resolver")
    void shouldRequireResolver() {
      assertThatThrownBy(
              () -> alertService.resolve(open.getId(), new AlertResolution(" ", null, null)))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should throw for an unknown alert")
    void shouldThrow_whenUnknown() {
      UUID unknown = UUID.randomUUID();
      when(alertRepository.findById(unknown)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> alertService.get(unknown))
          .isInstanceOf(AlertNotFoundException.class);
    }
  }

  @Test
  @DisplayName("Should filter the alert list by resolution and kind")
  void shouldFilterList() {
    // When
    alertService.list(false, AlertKind.LOW_CONFIDENCE_MATCH);
    alertService.list(true, null);
    alertService.list(null, AlertKind.CONFLICTING_DEAL_STATE);
    alertService.list(null, null);

    // Then
    verify(alertRepository)
        .findByResolvedAndKindOrderByCreatedAtDesc(false, AlertKind.LOW_CONFIDENCE_MATCH);
    verify(alertRepository).findByResolvedOrderByCreatedAtDesc(true);
    verify(alertRepository).findByKindOrderByCreatedAtDesc(AlertKind.CONFLICTING_DEAL_STATE);
    verify(alertRepository).findAllByOrderByCreatedAtDesc();
  }

  @Test
  @DisplayName("Should count unresolved alerts by kind")
  void shouldComputeStats() {
    // Given
    when(alertRepository.count()).thenReturn(5L);
    when(alertRepository.countByResolved(false)).thenReturn(3L);
    when(alertRepository.countUnresolvedByKind())
        .thenReturn(
            List.of(
                new Object[] {AlertKind.LOW_CONFIDENCE_MATCH, 2L},
                new Object[] {AlertKind.UNPARSED_MATERIAL_EXHIBIT, 1L}));

    // When
    AlertStats stats = alertService.stats();

    // Then
    assertThat(stats.total()).isEqualTo(5);
    assertThat(stats.unresolved()).isEqualTo(3);
    assertThat(stats.unresolvedByKind())
        .containsEntry(AlertKind.LOW_CONFIDENCE_MATCH, 2L)
        .containsEntry(AlertKind.UNPARSED_MATERIAL_EXHIBIT, 1L);
  }
}
