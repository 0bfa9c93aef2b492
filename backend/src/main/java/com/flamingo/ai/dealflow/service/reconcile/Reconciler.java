package com.flamingo.ai.dealflow.service.reconcile;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.service.extraction.NameSimilarity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores a financing event against candidate deals.
 *
 * <p>A target match is the only signal strong enough to link on its own. Acquirer and sponsor
 * matches add confidence but a candidate without a target match always goes to review.
 */
@Component
public class Reconciler {

  private static final double EPSILON = 1e-9;
  private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

  private final DealflowConfig config;

  public Reconciler(DealflowConfig config) {
    this.config = config;
  }

  /**
   * Score of one deal.
   *
   * @param dealId the deal
   * @param confidence capped sum of the fired signals
   * @param targetMatched whether a target signal fired
   * @param explanation fired signals with their strength
   */
  public record Candidate(
      UUID dealId, double confidence, boolean targetMatched, String explanation) {}

  /** Picks the deal for an event, or says why none can be linked automatically. */
  public ReconciliationDecision decide(FinancingEvent event, Collection<Deal> deals) {
    DealflowConfig.Reconciliation settings = config.getReconciliation();
    List<Candidate> ranked =
        deals.stream()
            .map(deal -> score(event, deal))
            .filter(candidate -> candidate.confidence() > 0)
            .sorted(
                Comparator.comparingDouble(Candidate::confidence)
                    .reversed()
                    .thenComparing(Candidate::dealId))
            .toList();
    if (ranked.isEmpty()) {
      return ReconciliationDecision.noMatch();
    }

    Candidate best = ranked.get(0);
    List<Candidate> close =
        ranked.stream()
            .filter(
                c -> best.confidence() - c.confidence() < settings.getAmbiguityMargin() - EPSILON)
            .toList();
    List<UUID> candidateIds = ranked.stream().map(Candidate::dealId).toList();

    if (close.size() > 1) {
      return new ReconciliationDecision(
          ReconciliationDecision.Outcome.AMBIGUOUS,
          null,
          best.confidence(),
          close.size() + " deals score within the ambiguity margin; best: " + best.explanation(),
          close.stream().map(Candidate::dealId).toList());
    }
    if (best.targetMatched() && best.confidence() >= settings.getMinConfidence() - EPSILON) {
      return new ReconciliationDecision(
          ReconciliationDecision.Outcome.LINK,
          best.dealId(),
          best.confidence(),
          best.explanation(),
          List.of());
    }
    String reason = best.targetMatched() ? "Below minimum confidence" : "No target match";
    return new ReconciliationDecision(
        ReconciliationDecision.Outcome.LOW_CONFIDENCE,
        null,
        best.confidence(),
        reason + "; " + best.explanation(),
        candidateIds);
  }

  /** Scores one deal; zero confidence when no signal fires. */
  public Candidate score(FinancingEvent event, Deal deal) {
    DealflowConfig.Reconciliation settings = config.getReconciliation();
    List<String> signals = new ArrayList<>();
    double confidence = 0.0;
    boolean targetMatched = false;

    String target = deal.getTargetNameNormalized();
    if (event.getPurposeTargetNormalized() != null) {
      double strength =
          nameSignal(
              "target name",
              event.getPurposeTargetNormalized(),
              target,
              settings.getTargetExactWeight(),
              settings.getTargetFuzzyWeight(),
              signals);
      confidence += strength;
      targetMatched = strength > 0;
    } else if (mentions(event.getEvidenceSnippet(), target)) {
      confidence += settings.getTargetExactWeight();
      targetMatched = true;
      signals.add(
          String.format(
              Locale.ROOT,
              "target name '%s' in evidence (+%.2f)",
              target,
              settings.getTargetExactWeight()));
    }

    if (event.getIssuerIdentifier() != null
        && event.getIssuerIdentifier().equals(deal.getAcquirerIdentifier())) {
      confidence += settings.getAcquirerExactWeight();
      signals.add(
          String.format(
              Locale.ROOT,
              "acquirer identifier %s exact (+%.2f)",
              deal.getAcquirerIdentifier(),
              settings.getAcquirerExactWeight()));
    } else {
      confidence +=
          nameSignal(
              "acquirer name",
              event.getIssuerNameNormalized(),
              deal.getAcquirerNameNormalized(),
              settings.getAcquirerExactWeight(),
              settings.getAcquirerFuzzyWeight(),
              signals);
    }

    double sponsorBest = 0.0;
    List<String> sponsorSignal = new ArrayList<>();
    for (String sponsor : event.getSponsorNamesNormalized()) {
      List<String> fired = new ArrayList<>();
      double strength =
          nameSignal(
              "sponsor",
              sponsor,
              deal.getSponsorNameNormalized(),
              settings.getSponsorExactWeight(),
              settings.getSponsorFuzzyWeight(),
              fired);
      if (strength > sponsorBest) {
        sponsorBest = strength;
        sponsorSignal = fired;
      }
    }
    confidence += sponsorBest;
    signals.addAll(sponsorSignal);

    return new Candidate(
        deal.getId(),
        Math.min(confidence, 1.0),
        targetMatched,
        signals.isEmpty() ? "no signals" : String.join("; ", signals));
  }

  private double nameSignal(
      String label,
      String eventName,
      String dealName,
      double exactWeight,
      double fuzzyWeight,
      List<String> signals) {
    if (eventName == null || eventName.isBlank() || dealName == null || dealName.isBlank()) {
      return 0.0;
    }
    if (eventName.equals(dealName)) {
      signals.add(
          String.format(Locale.ROOT, "%s '%s' exact (+%.2f)", label, dealName, exactWeight));
      return exactWeight;
    }
    double similarity = NameSimilarity.ratio(eventName, dealName);
    if (similarity >= config.getReconciliation().getFuzzyThreshold()) {
      double strength = fuzzyWeight * similarity;
      signals.add(
          String.format(
              Locale.ROOT,
              "%s '%s' ~ '%s' %.0f%% similar (+%.2f)",
              label,
              eventName,
              dealName,
              similarity * 100,
              strength));
      return strength;
    }
    return 0.0;
  }

  /** Whole-word occurrence of a normalized name in free text. */
  static boolean mentions(String text, String normalizedName) {
    if (text == null || normalizedName == null || normalizedName.isBlank()) {
      return false;
    }
    String words = " " + NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ") + " ";
    String name = " " + NON_WORD.matcher(normalizedName).replaceAll(" ").trim() + " ";
    return !name.isBlank() && words.contains(name);
  }
}
