package com.flamingo.ai.dealflow.service.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.dealflow.exception.ReferenceDataException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

class SponsorSeedListLoaderTest {

  private SponsorSeedListLoader loader;

  @BeforeEach
  void setUp() {
    loader = new SponsorSeedListLoader(new ObjectMapper());
  }

  private static ByteArrayResource json(String content) {
    return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8), "test seeds");
  }

  @Test
  @DisplayName("Should load the shipped seed list")
  void shouldLoadShippedList() {
    // When
    SponsorSeedList seeds = loader.load(new ClassPathResource("reference/sponsor-seeds.json"));

    // Then
    assertThat(seeds.size()).isGreaterThan(10);
    assertThat(seeds.resolve("Kohlberg Kravis Roberts")).isPresent();
  }

  @Test
  @DisplayName("Should lower-case aliases")
  void shouldLowerCaseAliases() {
    // When
    SponsorSeedList seeds =
        loader.load(json("{\"sponsors\": [{\"name\": \"TPG\", \"aliases\": [\" TPG \"]}]}"));

    // Then
    assertThat(seeds.sponsors().get(0).aliases()).containsExactly("tpg");
  }

  @Test
  @DisplayName("Should fail when the file is missing")
  void shouldFail_whenMissing() {
    assertThatThrownBy(() -> loader.load(new ClassPathResource("reference/absent.json")))
        .isInstanceOf(ReferenceDataException.class)
        .hasMessageContaining("not found");
  }

  @Test
  @DisplayName("Should fail on malformed JSON")
  void shouldFail_onMalformedJson() {
    assertThatThrownBy(() -> loader.load(json("{\"sponsors\": [")))
        .isInstanceOf(ReferenceDataException.class)
        .hasMessageContaining("not valid JSON")
        .hasMessageContaining("test seeds");
  }

  @Test
  @DisplayName("Should fail when there are no sponsors")
  void shouldFail_whenEmpty() {
    assertThatThrownBy(() -> loader.load(json("{\"sponsors\": []}")))
        .isInstanceOf(ReferenceDataException.class)
        .hasMessageContaining("no 'sponsors' entries");
  }

  @Test
  @DisplayName("Should fail when a sponsor has no aliases")
  void shouldFail_whenAliasesMissing() {
    assertThatThrownBy(() -> loader.load(json("{\"sponsors\": [{\"name\": \"TPG\"}]}")))
        .isInstanceOf(ReferenceDataException.class)
        .hasMessageContaining("'TPG' has no aliases");
  }

  @Test
  @DisplayName("Should fail when two sponsors claim one alias")
  void shouldFail_onSharedAlias() {
    // Given
    String content =
        "{\"sponsors\": ["
            + "{\"name\": \"Apollo\", \"aliases\": [\"apollo\"]},"
            + "{\"name\": \"Apollo Partners\", \"aliases\": [\"Apollo\"]}]}";

    // When / Then
    assertThatThrownBy(() -> loader.load(json(content)))
        .isInstanceOf(ReferenceDataException.class)
        .hasMessageContaining("claimed by both 'Apollo' and 'Apollo Partners'");
  }
}
