package com.flamingo.ai.dealflow.service.classify;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives sponsor and market tags from clustered state. Reads only facts already attached and
 * events already linked; never looks at document text.
 */
@Component
public class DealClassifier {

  private static final int CI = Pattern.CASE_INSENSITIVE;

  private static final Pattern BRIDGE =
      Pattern.compile("\\bbridge\\b|\\binterim\\s+financing\\b|\\btemporary\\s+financing\\b", CI);
  private static final Pattern TERM_LOAN_B =
      Pattern.compile(
          "\\bterm\\s+loan\\s+b\\b|\\btlb\\b|\\btl\\s*b\\b|\\binstitutional\\s+term\\s+loans?\\b"
              + "|\\bterm\\s+b\\b",
          CI);
  private static final Pattern REVOLVER =
      Pattern.compile(
          "\\brevolving\\b|\\brcf\\b|\\brevolver\\b|\\babl\\b"
              + "|\\basset[-\\s]based\\s+(?:lending|loan)\\b",
          CI);
  private static final Pattern IG_WORDS = Pattern.compile("\\binvestment[-\\s]grade\\b", CI);
  private static final Pattern HY_WORDS =
      Pattern.compile(
          "\\bhigh[-\\s]yield\\b|\\bleveraged\\b|\\blevfin\\b|\\bjunk\\b"
              + "|\\bsub[-\\s]?investment[-\\s]grade\\b",
          CI);
  // rating symbols are case-sensitive so the article "a" never reads as a rating
  private static final Pattern IG_RATINGS =
      Pattern.compile("\\b(?:AAA|AA[+-]?|A[+-]|BBB[+-]?|Aaa|Aa[1-3]|A[1-3]|Baa[1-3]|IG)(?![\\w])");
  private static final Pattern HY_RATINGS =
      Pattern.compile("\\b(?:BB[+-]?|B[+-]|CCC[+-]?|Ba[1-3]|B[1-3]|Caa[1-3]|HY)(?![\\w])");

  /** Covers every tag, so the headline tag never depends on event order. */
  private static final List<MarketTag> DEAL_TAG_PRIORITY =
      List.of(
          MarketTag.TERM_LOAN_B,
          MarketTag.HY_BOND,
          MarketTag.BRIDGE,
          MarketTag.IG_BOND,
          MarketTag.OTHER_LOAN,
          MarketTag.UNKNOWN);

  private final DealflowConfig config;

  public DealClassifier(DealflowConfig config) {
    this.config = config;
  }

  /**
   * Sponsor tag of a deal from its attached facts. The latest manual sponsor fact decides; then any
   * resolved automatic sponsor fact above the threshold; an open deal without sponsor evidence is
   * strategic.
   */
  public SponsorBacking sponsorBacking(Deal deal, Collection<AtomicFact> attachedFacts) {
    List<AtomicFact> sponsorFacts =
        attachedFacts.stream().filter(f -> f.getKind() == FactKind.SPONSOR_MENTION).toList();

    Optional<AtomicFact> latestManual =
        sponsorFacts.stream()
            .filter(AtomicFact::isManual)
            .max(Comparator.comparing(AtomicFact::getCreatedAt));
    if (latestManual.isPresent()) {
      return isAbsent(latestManual.get())
          ? SponsorBacking.STRATEGIC
          : SponsorBacking.SPONSOR_BACKED;
    }

    double threshold = config.getClassification().getSponsorMinConfidence();
    boolean resolvedSponsor =
        sponsorFacts.stream()
            .filter(f -> !isAbsent(f))
            .filter(f -> !flag(f, PayloadKeys.UNRESOLVED_SPONSOR_ENTITY))
            .anyMatch(f -> f.getConfidence() >= threshold);
    if (resolvedSponsor) {
      return SponsorBacking.SPONSOR_BACKED;
    }
    if (deal.getState() == DealState.OPEN && sponsorFacts.isEmpty()) {
      return SponsorBacking.STRATEGIC;
    }
    return SponsorBacking.UNKNOWN;
  }

  /**
   * Market tag of a financing event: bridge, then term loan B, then revolver, then bonds split by
   * credit quality, then other loans.
   */
  public MarketTag eventTag(FinancingEvent event, SponsorBacking backing) {
    String text = textOf(event);
    InstrumentFamily family = event.getInstrumentFamily();
    if (family == InstrumentFamily.BRIDGE || BRIDGE.matcher(text).find()) {
      return MarketTag.BRIDGE;
    }
    if (TERM_LOAN_B.matcher(text).find()) {
      return MarketTag.TERM_LOAN_B;
    }
    if (REVOLVER.matcher(text).find()) {
      return MarketTag.OTHER_LOAN;
    }
    boolean highYield = HY_WORDS.matcher(text).find() || HY_RATINGS.matcher(text).find();
    boolean investmentGrade = IG_WORDS.matcher(text).find() || IG_RATINGS.matcher(text).find();
    if (family == InstrumentFamily.BOND) {
      if (highYield && !investmentGrade) {
        return MarketTag.HY_BOND;
      }
      if (investmentGrade) {
        return MarketTag.IG_BOND;
      }
      return backing == SponsorBacking.SPONSOR_BACKED ? MarketTag.HY_BOND : MarketTag.IG_BOND;
    }
    if (family == InstrumentFamily.LOAN) {
      return highYield ? MarketTag.TERM_LOAN_B : MarketTag.OTHER_LOAN;
    }
    return MarketTag.UNKNOWN;
  }

  /** Headline tag of a deal from its events' tags; empty when it has none. */
  public Optional<MarketTag> dealTag(Collection<MarketTag> eventTags) {
    return DEAL_TAG_PRIORITY.stream().filter(eventTags::contains).findFirst();
  }

  private static String textOf(FinancingEvent event) {
    String type = event.getInstrumentType() == null ? "" : event.getInstrumentType();
    String evidence = event.getEvidenceSnippet() == null ? "" : event.getEvidenceSnippet();
    return type + " " + evidence;
  }

  private static boolean isAbsent(AtomicFact fact) {
    return flag(fact, PayloadKeys.SPONSOR_ABSENT);
  }

  private static boolean flag(AtomicFact fact, String key) {
    return fact.payloadValue(key).map(Boolean::parseBoolean).orElse(false);
  }
}
