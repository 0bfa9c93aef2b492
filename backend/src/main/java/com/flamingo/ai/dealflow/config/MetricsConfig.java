package com.flamingo.ai.dealflow.config;

import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import com.flamingo.ai.dealflow.domain.enums.ReconciliationStatus;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FinancingEventRepository;
import com.flamingo.ai.dealflow.domain.repository.ProcessingAlertRepository;
import com.flamingo.ai.dealflow.domain.repository.SourceDocumentRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for stage timings and the gauges describing work waiting on the pipeline. */
@Configuration
public class MetricsConfig {

  static final List<DocumentStatus> BACKLOG_STATUSES =
      List.of(DocumentStatus.PENDING, DocumentStatus.FAILED);

  /** Enables {@code @Timed} on the pipeline stage and service entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Registers the backlog gauges. Each is read from the database when the registry is scraped:
   * documents still to extract or retry, deals held for review, financing events awaiting a
   * reviewer and unresolved alerts.
   */
  @Bean
  public MeterBinder pipelineBacklogMetrics(
      SourceDocumentRepository documentRepository,
      DealRepository dealRepository,
      FinancingEventRepository financingEventRepository,
      ProcessingAlertRepository alertRepository) {
    return registry -> {
      for (DocumentStatus status : BACKLOG_STATUSES) {
        Gauge.builder(
                "dealflow.documents.backlog", documentRepository, r -> r.countByStatus(status))
            .tag("status", status.name())
            .description("Documents waiting for extraction or a retry")
            .register(registry);
      }
      Gauge.builder(
              "dealflow.deals.needs_review",
              dealRepository,
              r -> r.countByState(DealState.NEEDS_REVIEW))
          .description("Deals held until a reviewer resumes them")
          .register(registry);
      Gauge.builder(
              "dealflow.financing.pending_review",
              financingEventRepository,
              r -> r.countByReconciliationStatus(ReconciliationStatus.PENDING_REVIEW))
          .description("Financing events whose deal link awaits review")
          .register(registry);
      Gauge.builder("dealflow.alerts.unresolved", alertRepository, r -> r.countByResolved(false))
          .description("Processing alerts not yet resolved")
          .register(registry);
    };
  }
}
