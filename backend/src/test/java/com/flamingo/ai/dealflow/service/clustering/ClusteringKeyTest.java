package com.flamingo.ai.dealflow.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.service.clustering.ClusteringKey.Parties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClusteringKeyTest {

  @Test
  @DisplayName("Should prefer identifiers on both sides over any name-based key")
  void shouldPreferIdentifiers() {
    // Given
    Parties parties = new Parties("0000111", "acme", "0000222", "beta");

    // When / Then
    assertThat(ClusteringKey.candidates(parties))
        .extracting(ClusteringKey::tier)
        .containsExactly(
            ClusteringKeyTier.IDENTIFIERS,
            ClusteringKeyTier.ACQUIRER_IDENTIFIER,
            ClusteringKeyTier.NAMES);
    assertThat(ClusteringKey.derive(parties))
        .hasValueSatisfying(k -> assertThat(k.value()).isEqualTo("cik:0000111:cik:0000222"));
  }

  @Test
  @DisplayName("Should fall back to names when no identifier is known")
  void shouldFallBackToNames() {
    assertThat(ClusteringKey.derive(new Parties(null, "acme", null, "beta")))
        .hasValueSatisfying(
            k -> {
              assertThat(k.value()).isEqualTo("name:acme:name:beta");
              assertThat(k.tier()).isEqualTo(ClusteringKeyTier.NAMES);
            });
  }

  @Test
  @DisplayName("Should derive no key when one side is missing")
  void shouldDeriveNothing_whenSideMissing() {
    assertThat(ClusteringKey.derive(new Parties(null, null, "0000222", "beta"))).isEmpty();
    assertThat(ClusteringKey.derive(new Parties("0000111", "acme", null, " "))).isEmpty();
  }
}
