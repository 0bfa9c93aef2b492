package com.flamingo.ai.dealflow.service.reference;

import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable fee reference data: advisory brackets, underwriting rates per market tag and role
 * weights per instrument family.
 */
public final class RateTable {

  /** Weight key used for roles a split table does not list. */
  public static final String OTHER_ROLE = "other";

  /** Role-split key used when an instrument family has no table of its own. */
  public static final String UNKNOWN_FAMILY = "unknown";

  /** Role-split key for advisory fees. */
  public static final String ADVISORY_FAMILY = "advisory";

  /**
   * Advisory bracket: applies to deal values at or above {@code minDealValue}.
   *
   * @param minDealValue inclusive lower bound
   * @param bps fee in basis points
   */
  public record AdvisoryBracket(BigDecimal minDealValue, BigDecimal bps) {}

  private final List<AdvisoryBracket> advisoryBrackets;
  private final Map<MarketTag, BigDecimal> underwritingBps;
  private final Map<String, Map<String, BigDecimal>> roleSplits;
  private final Map<String, BigDecimal> thresholds;

  public RateTable(
      List<AdvisoryBracket> advisoryBrackets,
      Map<MarketTag, BigDecimal> underwritingBps,
      Map<String, Map<String, BigDecimal>> roleSplits,
      Map<String, BigDecimal> thresholds) {
    this.advisoryBrackets =
        advisoryBrackets.stream()
            .sorted(Comparator.comparing(AdvisoryBracket::minDealValue))
            .toList();
    this.underwritingBps = Map.copyOf(underwritingBps);
    this.roleSplits =
        roleSplits.entrySet().stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    Map.Entry::getKey, e -> Map.copyOf(e.getValue())));
    this.thresholds = Map.copyOf(thresholds);
  }

  /** Basis points of the highest bracket whose lower bound does not exceed the deal value. */
  public BigDecimal advisoryBps(BigDecimal dealValue) {
    BigDecimal bps = advisoryBrackets.get(0).bps();
    for (AdvisoryBracket bracket : advisoryBrackets) {
      if (dealValue.compareTo(bracket.minDealValue()) >= 0) {
        bps = bracket.bps();
      }
    }
    return bps;
  }

  /** Underwriting basis points for a market tag, falling back to the {@code UNKNOWN} rate. */
  public BigDecimal underwritingBps(MarketTag tag) {
    MarketTag key = tag == null ? MarketTag.UNKNOWN : tag;
    return underwritingBps.getOrDefault(key, underwritingBps.get(MarketTag.UNKNOWN));
  }

  /**
   * Weight of a normalized role within a family's split table; unknown roles use the {@code
   * other} weight, unknown families the {@code unknown} table.
   */
  public BigDecimal roleWeight(String family, String role) {
    Map<String, BigDecimal> splits =
        roleSplits.getOrDefault(family, roleSplits.get(UNKNOWN_FAMILY));
    if (splits == null) {
      return BigDecimal.ZERO;
    }
    BigDecimal weight = role == null ? null : splits.get(role);
    return weight != null ? weight : splits.getOrDefault(OTHER_ROLE, BigDecimal.ZERO);
  }

  public Optional<BigDecimal> threshold(String name) {
    return Optional.ofNullable(thresholds.get(name));
  }

  public List<AdvisoryBracket> advisoryBrackets() {
    return advisoryBrackets;
  }

  public Map<String, Map<String, BigDecimal>> roleSplits() {
    return roleSplits;
  }
}
