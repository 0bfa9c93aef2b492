package com.flamingo.ai.dealflow.service.clustering;

/**
 * Counts from one clustering pass.
 *
 * @param factsScanned unattached facts considered
 * @param factsAttached facts attached to a deal
 * @param dealsCreated new candidate deals
 * @param dealsPromoted deals promoted to open
 * @param conflicts facts that hit a closed or locked deal
 * @param deferred facts left unattached for a later pass or a reviewer
 * @param retried groups rolled back by a concurrent writer and left for the next pass
 */
public record ClusteringSummary(
    int factsScanned,
    int factsAttached,
    int dealsCreated,
    int dealsPromoted,
    int conflicts,
    int deferred,
    int retried) {

  static ClusteringSummary empty() {
    return new ClusteringSummary(0, 0, 0, 0, 0, 0, 0);
  }
}
