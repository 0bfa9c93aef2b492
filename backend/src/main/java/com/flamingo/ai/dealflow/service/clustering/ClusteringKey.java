package com.flamingo.ai.dealflow.service.clustering;

import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A deal clustering key and its tier.
 *
 * @param value key string, e.g. {@code cik:0000123:name:beta}
 * @param tier priority tier of the key
 */
public record ClusteringKey(String value, ClusteringKeyTier tier) {

  /** Party fields a key is derived from; any may be null. */
  public record Parties(
      String acquirerIdentifier,
      String acquirerName,
      String targetIdentifier,
      String targetName) {

    public static Parties of(Deal deal) {
      return new Parties(
          deal.getAcquirerIdentifier(),
          deal.getAcquirerNameNormalized(),
          deal.getTargetIdentifier(),
          deal.getTargetNameNormalized());
    }

    boolean hasAcquirerIdentifier() {
      return present(acquirerIdentifier);
    }

    boolean hasTargetIdentifier() {
      return present(targetIdentifier);
    }

    boolean hasAcquirerName() {
      return present(acquirerName);
    }

    boolean hasTargetName() {
      return present(targetName);
    }
  }

  /** Best key the parties support, or empty when neither side is identified. */
  public static Optional<ClusteringKey> derive(Parties parties) {
    List<ClusteringKey> keys = candidates(parties);
    return keys.isEmpty() ? Optional.empty() : Optional.of(keys.get(0));
  }

  /** Every key the parties support, best tier first. */
  public static List<ClusteringKey> candidates(Parties parties) {
    List<ClusteringKey> keys = new ArrayList<>();
    if (parties.hasAcquirerIdentifier() && parties.hasTargetIdentifier()) {
      keys.add(
          new ClusteringKey(
              "cik:" + parties.acquirerIdentifier() + ":cik:" + parties.targetIdentifier(),
              ClusteringKeyTier.IDENTIFIERS));
    }
    if (parties.hasAcquirerIdentifier() && parties.hasTargetName()) {
      keys.add(
          new ClusteringKey(
              "cik:" + parties.acquirerIdentifier() + ":name:" + parties.targetName(),
              ClusteringKeyTier.ACQUIRER_IDENTIFIER));
    }
    if (parties.hasAcquirerName() && parties.hasTargetName()) {
      keys.add(
          new ClusteringKey(
              "name:" + parties.acquirerName() + ":name:" + parties.targetName(),
              ClusteringKeyTier.NAMES));
    }
    return keys;
  }

  private static boolean present(String value) {
    return value != null && !value.isBlank();
  }
}
