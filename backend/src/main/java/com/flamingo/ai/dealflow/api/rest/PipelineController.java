package com.flamingo.ai.dealflow.api.rest;

import com.flamingo.ai.dealflow.service.pipeline.PipelineRunSummary;
import com.flamingo.ai.dealflow.service.pipeline.PipelineService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for triggering pipeline passes. */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

  private final PipelineService pipelineService;

  /** Runs one full pass synchronously and returns its counts. */
  @PostMapping("/runs")
  public ResponseEntity<PipelineRunSummary> run() {
    return ResponseEntity.ok(pipelineService.run());
  }

  @GetMapping("/status")
  public ResponseEntity<Map<String, Object>> status() {
    Map<String, Object> status = new HashMap<>();
    status.put("running", pipelineService.isRunning());
    status.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(status);
  }
}
