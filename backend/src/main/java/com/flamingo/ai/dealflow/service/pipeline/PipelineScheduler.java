package com.flamingo.ai.dealflow.service.pipeline;

import com.flamingo.ai.dealflow.exception.PipelineBusyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs the pipeline on a fixed delay when scheduling is enabled. */
@Component
@ConditionalOnProperty(name = "dealflow.pipeline.schedule.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler {

  private final PipelineService pipelineService;

  @Scheduled(
      fixedDelayString = "${dealflow.pipeline.schedule.fixed-delay:PT10M}",
      initialDelayString = "${dealflow.pipeline.schedule.fixed-delay:PT10M}")
  public void runScheduled() {
    try {
      PipelineRunSummary summary = pipelineService.run();
      log.debug("Scheduled pipeline pass finished at {}", summary.finishedAt());
    } catch (PipelineBusyException e) {
      log.info("Skipping scheduled pipeline pass: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Scheduled pipeline pass failed: {}", e.getMessage(), e);
    }
  }
}
