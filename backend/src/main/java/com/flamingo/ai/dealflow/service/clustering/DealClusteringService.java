package com.flamingo.ai.dealflow.service.clustering;

import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsLast;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import com.flamingo.ai.dealflow.service.alert.AlertService;
import com.flamingo.ai.dealflow.service.alert.Alerts;
import com.flamingo.ai.dealflow.service.extraction.NameSimilarity;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Groups unattached facts into deals.
 *
 * <p>Each pass scans every unattached clusterable fact in a fixed order. Manual facts aimed at a
 * deal attach to it first; the remaining facts are grouped per document and each group is
 * matched to a deal by its clustering keys, or creates a candidate deal. Every group runs under
 * the striped locks of its keys and in its own transaction, so a group rolled back by a
 * concurrent writer is simply picked up by the next pass.
 */
@Service
@Slf4j
public class DealClusteringService {

  static final Comparator<AtomicFact> PROCESSING_ORDER =
      Comparator.comparing(AtomicFact::getObservedOn, nullsLast(naturalOrder()))
          .thenComparing(AtomicFact::getDocumentId, nullsLast(naturalOrder()))
          .thenComparing(AtomicFact::getEvidenceStart, nullsLast(naturalOrder()))
          .thenComparing(AtomicFact::getId, nullsLast(naturalOrder()));

  private static final int MAX_MERGE_HOPS = 16;

  private final AtomicFactRepository factRepository;
  private final FactAttachmentRepository attachmentRepository;
  private final DealRepository dealRepository;
  private final DealIdentityUpdater identityUpdater;
  private final DealKeyLocks locks;
  private final AlertService alertService;
  private final DealflowConfig config;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public DealClusteringService(
      AtomicFactRepository factRepository,
      FactAttachmentRepository attachmentRepository,
      DealRepository dealRepository,
      DealIdentityUpdater identityUpdater,
      DealKeyLocks locks,
      AlertService alertService,
      DealflowConfig config,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.factRepository = factRepository;
    this.attachmentRepository = attachmentRepository;
    this.dealRepository = dealRepository;
    this.identityUpdater = identityUpdater;
    this.locks = locks;
    this.alertService = alertService;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Outcome of clustering one group of facts. */
  enum Outcome {
    ATTACHED,
    CREATED,
    CONFLICT,
    DEFERRED
  }

  /** Mutable counters for a single pass. */
  private static final class Tally {
    int scanned;
    int attached;
    int created;
    int promoted;
    int conflicts;
    int deferred;
    int retried;

    ClusteringSummary summary() {
      return new ClusteringSummary(
          scanned, attached, created, promoted, conflicts, deferred, retried);
    }
  }

  /**
   * Runs one clustering pass over all unattached facts.
   *
   * @return counts for the pass
   */
  @Timed(value = "dealflow.clustering", description = "Time to run a clustering pass")
  public ClusteringSummary cluster() {
    List<AtomicFact> facts =
        factRepository.findUnattachedByKindIn(FactKind.clusterable()).stream()
            .sorted(PROCESSING_ORDER)
            .toList();
    if (facts.isEmpty()) {
      log.debug("No unattached facts to cluster");
      return ClusteringSummary.empty();
    }

    Tally tally = new Tally();
    tally.scanned = facts.size();

    Map<UUID, List<AtomicFact>> directed = new LinkedHashMap<>();
    Map<UUID, List<AtomicFact>> byDocument = new LinkedHashMap<>();
    for (AtomicFact fact : facts) {
      if (fact.isManual() && fact.getTargetDealId() != null) {
        directed.computeIfAbsent(fact.getTargetDealId(), id -> new ArrayList<>()).add(fact);
      } else {
        UUID groupId = fact.getDocumentId() != null ? fact.getDocumentId() : fact.getId();
        byDocument.computeIfAbsent(groupId, id -> new ArrayList<>()).add(fact);
      }
    }

    directed.forEach(
        (dealId, group) ->
            runGroup(
                tally, group, Set.of(dealLockKey(dealId)), () -> attachDirected(dealId, group)));
    byDocument.forEach((groupId, group) -> clusterDocumentGroup(tally, group));

    flagSimilarDeals();

    ClusteringSummary summary = tally.summary();
    log.info(
        "Clustering pass: {} facts scanned, {} attached, {} deals created, {} promoted, "
            + "{} conflicts, {} deferred, {} retried",
        summary.factsScanned(),
        summary.factsAttached(),
        summary.dealsCreated(),
        summary.dealsPromoted(),
        summary.conflicts(),
        summary.deferred(),
        summary.retried());
    return summary;
  }

  private void clusterDocumentGroup(Tally tally, List<AtomicFact> group) {
    UUID documentId = group.get(0).getDocumentId();
    Optional<UUID> affinity = documentId == null ? Optional.empty() : affinityDeal(documentId);
    ClusteringKey.Parties parties = DealIdentityUpdater.partiesOf(group);

    Set<String> lockKeys = new LinkedHashSet<>();
    ClusteringKey.candidates(parties).forEach(key -> lockKeys.add(key.value()));
    affinity.ifPresent(id -> lockKeys.add(dealLockKey(id)));
    if (lockKeys.isEmpty()) {
      log.debug("Deferring {} facts of document {}: no parties known", group.size(), documentId);
      tally.deferred += group.size();
      return;
    }

    runGroup(
        tally,
        group,
        lockKeys,
        () -> {
          if (affinity.isPresent()) {
            return dealRepository
                .findById(affinity.get())
                .map(this::followMerges)
                .map(deal -> applyToDeal(deal, group, tally))
                .orElse(Outcome.DEFERRED);
          }
          Lookup lookup = lookup(parties, group);
          if (lookup.ambiguous()) {
            return Outcome.DEFERRED;
          }
          if (lookup.deal().isPresent()) {
            return applyToDeal(lookup.deal().get(), group, tally);
          }
          return hasIdentity(group) ? createDeal(parties, group, tally) : Outcome.DEFERRED;
        });
  }

  private void runGroup(Tally tally, List<AtomicFact> group, Set<String> lockKeys, GroupWork work) {
    try {
      Outcome outcome =
          locks.withLocks(lockKeys, () -> transactionTemplate.execute(status -> work.run()));
      switch (outcome) {
        case ATTACHED -> tally.attached += group.size();
        case CREATED -> {
          tally.created++;
          tally.attached += group.size();
        }
        case CONFLICT -> tally.conflicts += group.size();
        case DEFERRED -> tally.deferred += group.size();
        default -> throw new IllegalStateException("Unexpected outcome " + outcome);
      }
    } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
      tally.retried++;
      log.warn(
          "Concurrent update while clustering {} facts (keys {}); retrying next pass: {}",
          group.size(),
          lockKeys,
          e.getMessage());
    }
  }

  @FunctionalInterface
  private interface GroupWork {
    Outcome run();
  }

  /** Manual facts aimed at a deal attach regardless of its state. */
  private Outcome attachDirected(UUID dealId, List<AtomicFact> group) {
    Optional<Deal> found = dealRepository.findById(dealId).map(this::followMerges);
    if (found.isEmpty()) {
      log.warn("Manual facts {} name unknown deal {}", ids(group), dealId);
      return Outcome.DEFERRED;
    }
    Deal deal = found.get();
    attach(deal, group);
    identityUpdater.apply(deal, group);
    rekey(deal);
    promoteIfEligible(deal);
    dealRepository.save(deal);
    log.info("Attached {} manual facts to deal {}", group.size(), deal.getDealKey());
    return Outcome.ATTACHED;
  }

  private Outcome applyToDeal(Deal deal, List<AtomicFact> group, Tally tally) {
    DealState state = deal.getState();
    if (state.isTerminal()) {
      for (AtomicFact fact : group) {
        alertService.raise(Alerts.conflictingDealState(deal, fact));
      }
      deal.sendToReview(
          "New evidence from document " + group.get(0).getDocumentId() + " while " + state);
      dealRepository.save(deal);
      meterRegistry.counter("dealflow.clustering.conflicts").increment();
      log.warn("Deal {} is {}; {} facts held for review", deal.getDealKey(), state, group.size());
      return Outcome.CONFLICT;
    }
    if (state == DealState.NEEDS_REVIEW) {
      log.debug("Deal {} awaits review; leaving {} facts unattached", deal.getId(), group.size());
      return Outcome.DEFERRED;
    }

    attach(deal, group);
    identityUpdater.apply(deal, group);
    rekey(deal);
    if (promoteIfEligible(deal)) {
      tally.promoted++;
    }
    dealRepository.save(deal);
    return Outcome.ATTACHED;
  }

  private Outcome createDeal(ClusteringKey.Parties parties, List<AtomicFact> group, Tally tally) {
    Optional<ClusteringKey> key = ClusteringKey.derive(parties);
    if (key.isEmpty()) {
      return Outcome.DEFERRED;
    }
    Deal deal = Deal.builder().dealKey(key.get().value()).keyTier(key.get().tier()).build();
    identityUpdater.apply(deal, group);
    if (key.get().tier() == ClusteringKeyTier.NAMES) {
      deal.setReviewRequired(true);
      deal.setReviewReason(Deal.NAME_KEY_REVIEW_REASON);
    }
    if (promoteIfEligible(deal)) {
      tally.promoted++;
    }
    Deal saved = dealRepository.saveAndFlush(deal);
    attach(saved, group);
    meterRegistry.counter("dealflow.deals.created", "tier", key.get().tier().name()).increment();
    log.info(
        "Created {} deal {} from {} facts", saved.getState(), saved.getDealKey(), group.size());
    return Outcome.CREATED;
  }

  private void attach(Deal deal, List<AtomicFact> group) {
    attachmentRepository.saveAll(
        group.stream()
            .map(fact -> FactAttachment.attach(fact, deal.getId(), FactAttachment.CLUSTERING))
            .toList());
    meterRegistry.counter("dealflow.facts.attached").increment(group.size());
  }

  /**
   * Moves the deal to the best key its identity supports. A key held by another deal is left
   * alone and the pair is flagged for a merge decision.
   */
  public void rekey(Deal deal) {
    Optional<ClusteringKey> best = ClusteringKey.derive(ClusteringKey.Parties.of(deal));
    if (best.isEmpty() || best.get().value().equals(deal.getDealKey())) {
      return;
    }
    ClusteringKey key = best.get();
    Optional<Deal> holder = dealRepository.findByDealKey(key.value());
    if (holder.isPresent() && !holder.get().getId().equals(deal.getId())) {
      alertService.raise(
          Alerts.mergeCandidate(
              List.of(deal.getId(), holder.get().getId()),
              key.value(),
              "Deal " + deal.getDealKey() + " now resolves to a key held by another deal."));
      log.warn(
          "Rekey of {} to {} collides with deal {}",
          deal.getId(),
          key.value(),
          holder.get().getId());
      return;
    }
    log.info("Rekeying deal {} from {} to {}", deal.getId(), deal.getDealKey(), key.value());
    deal.rekey(key.value(), key.tier());
    if (key.tier() == ClusteringKeyTier.NAMES) {
      deal.setReviewRequired(true);
      deal.setReviewReason(Deal.NAME_KEY_REVIEW_REASON);
    }
  }

  /** Promotes a candidate whose both sides reach the promotion threshold. */
  public boolean promoteIfEligible(Deal deal) {
    double threshold = config.getClustering().getPromotionMinConfidence();
    if (deal.getState() != DealState.CANDIDATE
        || deal.getTargetConfidence() == null
        || deal.getAcquirerConfidence() == null
        || deal.getTargetConfidence() < threshold
        || deal.getAcquirerConfidence() < threshold) {
      return false;
    }
    deal.promote();
    meterRegistry.counter("dealflow.deals.promoted").increment();
    log.info("Promoted deal {} to OPEN", deal.getDealKey());
    return true;
  }

  /**
   * Result of a key lookup.
   *
   * @param deal the matched deal
   * @param ambiguous whether several active deals matched at one tier
   */
  private record Lookup(Optional<Deal> deal, boolean ambiguous) {}

  /**
   * Finds the deal for a set of parties, trying key tiers best first. Several active deals at one
   * tier make the lookup ambiguous: a merge-candidate alert is raised and the group is deferred.
   */
  private Lookup lookup(ClusteringKey.Parties parties, List<AtomicFact> group) {
    for (ClusteringKey key : ClusteringKey.candidates(parties)) {
      List<Deal> found = new ArrayList<>();
      dealRepository.findByDealKey(key.value()).ifPresent(found::add);
      switch (key.tier()) {
        case ACQUIRER_IDENTIFIER -> found.addAll(
            dealRepository.findByAcquirerIdentifierAndTargetNameNormalized(
                parties.acquirerIdentifier(), parties.targetName()));
        case NAMES -> found.addAll(
            dealRepository.findByAcquirerNameNormalizedAndTargetNameNormalized(
                parties.acquirerName(), parties.targetName()));
        default -> {}
      }
      Map<UUID, Deal> distinct = new LinkedHashMap<>();
      found.stream()
          .map(this::followMerges)
          .forEach(deal -> distinct.putIfAbsent(deal.getId(), deal));
      if (distinct.isEmpty()) {
        continue;
      }
      List<Deal> active =
          distinct.values().stream().filter(deal -> deal.getState().acceptsFacts()).toList();
      if (active.size() > 1) {
        alertService.raise(
            Alerts.mergeCandidate(
                active.stream().map(Deal::getId).toList(),
                key.value(),
                "Facts " + ids(group) + " match several active deals."));
        return new Lookup(Optional.empty(), true);
      }
      if (active.size() == 1) {
        return new Lookup(Optional.of(active.get(0)), false);
      }
      return new Lookup(
          distinct.values().stream()
              .min(Comparator.comparing(Deal::getCreatedAt, nullsLast(naturalOrder()))),
          false);
    }
    return new Lookup(Optional.empty(), false);
  }

  private Optional<UUID> affinityDeal(UUID documentId) {
    Set<UUID> dealIds =
        attachmentRepository.findByDocumentId(documentId).stream()
            .filter(FactAttachment::isAttached)
            .filter(attachment -> FactAttachment.CLUSTERING.equals(attachment.getAttachedBy()))
            .map(FactAttachment::getDealId)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    Set<UUID> resolved = new LinkedHashSet<>();
    for (UUID id : dealIds) {
      dealRepository.findById(id).map(this::followMerges).ifPresent(d -> resolved.add(d.getId()));
    }
    if (resolved.size() > 1) {
      log.warn("Document {} has facts on several deals {}; using the first", documentId, resolved);
    }
    return resolved.stream().findFirst();
  }

  /** Follows merge pointers to the surviving deal. */
  public Deal followMerges(Deal deal) {
    Deal current = deal;
    for (int hop = 0; current.isSuperseded() && hop < MAX_MERGE_HOPS; hop++) {
      UUID next = current.getMergedIntoDealId();
      Optional<Deal> survivor = dealRepository.findById(next);
      if (survivor.isEmpty()) {
        log.error("Deal {} points at missing survivor {}", current.getId(), next);
        return current;
      }
      current = survivor.get();
    }
    return current;
  }

  /** Flags active deals of one acquirer whose target names are near-identical. */
  void flagSimilarDeals() {
    double threshold = config.getClustering().getMergeCandidateSimilarity();
    List<Deal> active =
        dealRepository.findByStateInOrderByCreatedAtAsc(
            EnumSet.of(DealState.CANDIDATE, DealState.OPEN));
    Map<String, List<Deal>> byAcquirer =
        active.stream()
            .filter(deal -> deal.getTargetNameNormalized() != null)
            .filter(deal -> acquirerKey(deal) != null)
            .collect(
                Collectors.groupingBy(
                    DealClusteringService::acquirerKey, LinkedHashMap::new, Collectors.toList()));
    for (List<Deal> deals : byAcquirer.values()) {
      for (int i = 0; i < deals.size(); i++) {
        for (int j = i + 1; j < deals.size(); j++) {
          Deal left = deals.get(i);
          Deal right = deals.get(j);
          double similarity =
              NameSimilarity.ratio(left.getTargetNameNormalized(), right.getTargetNameNormalized());
          if (similarity >= threshold) {
            alertService.raise(
                Alerts.mergeCandidate(
                    List.of(left.getId(), right.getId()),
                    left.getDealKey(),
                    String.format(
                        "Target names '%s' and '%s' are %.0f%% similar for one acquirer.",
                        left.getTargetNameNormalized(),
                        right.getTargetNameNormalized(),
                        similarity * 100)));
          }
        }
      }
    }
  }

  private static String acquirerKey(Deal deal) {
    if (deal.getAcquirerIdentifier() != null) {
      return "cik:" + deal.getAcquirerIdentifier();
    }
    return deal.getAcquirerNameNormalized() == null
        ? null
        : "name:" + deal.getAcquirerNameNormalized();
  }

  private static boolean hasIdentity(Collection<AtomicFact> group) {
    return group.stream().anyMatch(fact -> fact.getKind().isIdentity());
  }

  private static String dealLockKey(UUID dealId) {
    return "deal:" + dealId;
  }

  private static List<UUID> ids(Collection<AtomicFact> facts) {
    return facts.stream().map(AtomicFact::getId).toList();
  }
}
