package com.flamingo.ai.dealflow.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.dealflow.exception.ApiError;
import com.flamingo.ai.dealflow.exception.GlobalExceptionHandler;
import com.flamingo.ai.dealflow.exception.PipelineBusyException;
import com.flamingo.ai.dealflow.service.pipeline.PipelineRunSummary;
import com.flamingo.ai.dealflow.service.pipeline.PipelineService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineController Tests")
class PipelineControllerTest {

  private MockMvc mockMvc;

  @Mock private PipelineService pipelineService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PipelineController(pipelineService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should run a pass and return its counts")
  void shouldRunPass() throws Exception {
    Instant now = Instant.now();
    when(pipelineService.run())
        .thenReturn(new PipelineRunSummary(2, 1, 17, 3, null, null, null, null, now, now));

    mockMvc
        .perform(post("/api/pipeline/runs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.documentsProcessed").value(2))
        .andExpect(jsonPath("$.factsStored").value(17));
  }

  @Test
  @DisplayName("Should return 409 while a pass is running")
  void shouldReturnConflict_whenBusy() throws Exception {
    when(pipelineService.run()).thenThrow(new PipelineBusyException());

    mockMvc
        .perform(post("/api/pipeline/runs"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.PIPELINE_BUSY));
  }

  @Test
  @DisplayName("Should report whether a pass is running")
  void shouldReportStatus() throws Exception {
    when(pipelineService.isRunning()).thenReturn(true);

    mockMvc
        .perform(get("/api/pipeline/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(true));
  }
}
