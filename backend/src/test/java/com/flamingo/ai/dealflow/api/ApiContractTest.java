package com.flamingo.ai.dealflow.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.api.rest.AlertController;
import com.flamingo.ai.dealflow.api.rest.DealController;
import com.flamingo.ai.dealflow.api.rest.DocumentController;
import com.flamingo.ai.dealflow.api.rest.FactController;
import com.flamingo.ai.dealflow.api.rest.PipelineController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify controllers stay mapped to the published paths:
 *
 * <ul>
 *   <li>POST /api/documents - Submit document
 *   <li>POST /api/documents/upload - Upload document file
 *   <li>GET /api/deals - List deals
 *   <li>POST /api/deals/merge - Merge deals
 *   <li>POST /api/deals/{id}/manual-facts - Enter manual facts
 *   <li>GET /api/alerts - Review queue
 *   <li>POST /api/alerts/{id}/resolve - Resolve alert
 *   <li>POST /api/facts/{id}/dismiss - Dismiss fact
 *   <li>POST /api/pipeline/runs - Run a pipeline pass
 * </ul>
 */
class ApiContractTest {

  private static RequestMapping mappingOf(Class<?> controller) {
    RequestMapping mapping = controller.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    return mapping;
  }

  private static String[] postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map((Method method) -> method.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped to /api/documents")
    void shouldBeMappedToApiDocuments() {
      assertThat(mappingOf(DocumentController.class).value()).containsExactly("/api/documents");
      assertThat(postPaths(DocumentController.class)).contains("/upload");
    }
  }

  @Nested
  @DisplayName("DealController API contract")
  class DealControllerContract {

    @Test
    @DisplayName("should be mapped to /api/deals with reviewer actions")
    void shouldBeMappedToApiDeals() {
      assertThat(mappingOf(DealController.class).value()).containsExactly("/api/deals");
      assertThat(postPaths(DealController.class))
          .contains(
              "/merge",
              "/{dealId}/lock",
              "/{dealId}/close",
              "/{dealId}/resume",
              "/{dealId}/manual-facts");
    }
  }

  @Nested
  @DisplayName("AlertController API contract")
  class AlertControllerContract {

    @Test
    @DisplayName("should be mapped to /api/alerts")
    void shouldBeMappedToApiAlerts() {
      assertThat(mappingOf(AlertController.class).value()).containsExactly("/api/alerts");
      assertThat(postPaths(AlertController.class)).containsExactly("/{alertId}/resolve");
    }
  }

  @Nested
  @DisplayName("FactController API contract")
  class FactControllerContract {

    @Test
    @DisplayName("should be mapped to /api/facts")
    void shouldBeMappedToApiFacts() {
      assertThat(mappingOf(FactController.class).value()).containsExactly("/api/facts");
      assertThat(postPaths(FactController.class)).containsExactly("/{factId}/dismiss");
    }
  }

  @Nested
  @DisplayName("PipelineController API contract")
  class PipelineControllerContract {

    @Test
    @DisplayName("should be mapped to /api/pipeline")
    void shouldBeMappedToApiPipeline() {
      assertThat(mappingOf(PipelineController.class).value()).containsExactly("/api/pipeline");
      assertThat(postPaths(PipelineController.class)).containsExactly("/runs");
    }
  }
}
