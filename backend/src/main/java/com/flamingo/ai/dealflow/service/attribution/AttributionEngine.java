package com.flamingo.ai.dealflow.service.attribution;

import com.flamingo.ai.dealflow.domain.entity.FinancingEvent;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.service.reference.RateTable;
import com.flamingo.ai.dealflow.service.table.ParticipantRoles;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Modeled fees from the rate table. Every rate comes from {@link RateTable}; nothing here is
 * hardcoded beyond the basis-point divisor.
 */
@Component
public class AttributionEngine {

  /** Threshold below which a financing amount is not attributed. */
  public static final String MIN_FINANCING_AMOUNT = "min_financing_amount";

  static final BigDecimal BPS_PER_UNIT = BigDecimal.valueOf(10_000);
  private static final int MONEY_SCALE = 2;

  private final RateTable rateTable;

  public AttributionEngine(RateTable rateTable) {
    this.rateTable = rateTable;
  }

  /**
   * A participant's part of a fee.
   *
   * @param weight role weight from the family's split table
   * @param fee allocated amount
   */
  public record Share(BigDecimal weight, BigDecimal fee) {}

  /** Underwriting fee of an event from its amount and market tag; empty without an amount. */
  public Optional<BigDecimal> underwritingFee(FinancingEvent event) {
    BigDecimal amount = event.getAmount();
    if (amount == null || amount.signum() <= 0) {
      return Optional.empty();
    }
    Optional<BigDecimal> minimum = rateTable.threshold(MIN_FINANCING_AMOUNT);
    if (minimum.isPresent() && amount.compareTo(minimum.get()) < 0) {
      return Optional.empty();
    }
    return Optional.of(applyBps(amount, rateTable.underwritingBps(event.getMarketTag())));
  }

  /** Advisory fee on a deal value, using the bracket the value falls in. */
  public Optional<BigDecimal> advisoryFee(BigDecimal dealValue) {
    if (dealValue == null || dealValue.signum() <= 0) {
      return Optional.empty();
    }
    return Optional.of(applyBps(dealValue, rateTable.advisoryBps(dealValue)));
  }

  /**
   * Splits an underwriting fee across participants by the role weights of the event's family.
   *
   * @param roles normalized participant roles, one per participant
   * @return shares in the order of {@code roles}
   */
  public List<Share> splitUnderwriting(
      BigDecimal fee, InstrumentFamily family, List<String> roles) {
    String familyKey = (family == null ? InstrumentFamily.UNKNOWN : family).key();
    List<BigDecimal> weights =
        roles.stream().map(role -> rateTable.roleWeight(familyKey, role)).toList();
    return shares(fee, weights);
  }

  /** Splits an advisory fee evenly weighted by the advisory table across {@code advisors}. */
  public List<Share> splitAdvisory(BigDecimal fee, int advisors) {
    BigDecimal weight =
        rateTable.roleWeight(RateTable.ADVISORY_FAMILY, ParticipantRoles.FINANCIAL_ADVISOR);
    return shares(fee, Collections.nCopies(advisors, weight));
  }

  private static List<Share> shares(BigDecimal fee, List<BigDecimal> weights) {
    List<BigDecimal> fees = split(fee, weights);
    List<Share> shares = new ArrayList<>(weights.size());
    for (int i = 0; i < weights.size(); i++) {
      shares.add(new Share(weights.get(i), fees.get(i)));
    }
    return shares;
  }

  /** Pro-rata split; equal parts when every weight is zero. */
  static List<BigDecimal> split(BigDecimal total, List<BigDecimal> weights) {
    if (weights.isEmpty()) {
      return List.of();
    }
    BigDecimal sum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    List<BigDecimal> parts = new ArrayList<>(weights.size());
    for (BigDecimal weight : weights) {
      BigDecimal part =
          sum.signum() == 0
              ? total.divide(BigDecimal.valueOf(weights.size()), MONEY_SCALE, RoundingMode.HALF_UP)
              : total
                  .multiply(weight)
                  .divide(sum, MathContext.DECIMAL64)
                  .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
      parts.add(part);
    }
    return parts;
  }

  private static BigDecimal applyBps(BigDecimal amount, BigDecimal bps) {
    return amount
        .multiply(bps)
        .divide(BPS_PER_UNIT, MathContext.DECIMAL64)
        .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
  }
}
