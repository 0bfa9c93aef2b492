package com.flamingo.ai.dealflow;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.api.rest.DealController;
import com.flamingo.ai.dealflow.service.pipeline.PipelineService;
import com.flamingo.ai.dealflow.service.reference.RateTable;
import com.flamingo.ai.dealflow.service.reference.SponsorSeedList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/** Boots the full application against a throwaway SQLite file. */
@SpringBootTest
class DealflowApplicationTests {

  private static final Path DATABASE =
      Path.of(System.getProperty("java.io.tmpdir"), "dealflow-test-" + UUID.randomUUID() + ".db");

  @Autowired private ApplicationContext context;

  @DynamicPropertySource
  static void sqliteDatabase(DynamicPropertyRegistry registry) {
    registry.add(
        "spring.datasource.url",
        () -> "jdbc:sqlite:" + DATABASE + "?journal_mode=WAL&busy_timeout=10000");
  }

  @AfterAll
  static void deleteDatabase() throws IOException {
    for (String suffix : new String[] {"", "-wal", "-shm"}) {
      Files.deleteIfExists(Path.of(DATABASE + suffix));
    }
  }

  @Test
  @DisplayName("Should wire the pipeline, controllers and reference data")
  void contextLoads() {
    assertThat(context.getBean(PipelineService.class)).isNotNull();
    assertThat(context.getBean(DealController.class)).isNotNull();
    assertThat(context.getBean(RateTable.class).advisoryBrackets()).isNotEmpty();
    assertThat(context.getBean(SponsorSeedList.class)).isNotNull();
  }
}
