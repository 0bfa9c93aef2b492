package com.flamingo.ai.dealflow.support;

import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.service.reference.RateTable;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** The shipped rate table, built in code. */
public final class TestRates {

  private TestRates() {}

  public static RateTable standard() {
    return new RateTable(
        List.of(
            new RateTable.AdvisoryBracket(BigDecimal.ZERO, bd("50")),
            new RateTable.AdvisoryBracket(bd("1000000000"), bd("30")),
            new RateTable.AdvisoryBracket(bd("5000000000"), bd("20"))),
        Map.of(
            MarketTag.IG_BOND, bd("50"),
            MarketTag.HY_BOND, bd("150"),
            MarketTag.TERM_LOAN_B, bd("200"),
            MarketTag.OTHER_LOAN, bd("75"),
            MarketTag.BRIDGE, bd("100"),
            MarketTag.UNKNOWN, bd("100")),
        Map.of(
            "bond",
            Map.of(
                "joint_bookrunner", bd("1.0"),
                "underwriter", bd("0.5"),
                "co_manager", bd("0.25"),
                "other", bd("0.1")),
            "loan",
            Map.of("joint_lead_arranger", bd("1.0"), "agent", bd("0.25"), "other", bd("0.1")),
            "unknown",
            Map.of("other", bd("0.1")),
            "advisory",
            Map.of("financial_advisor", bd("1.0"), "other", bd("0.1"))),
        Map.of("min_financing_amount", bd("1000000")));
  }

  private static BigDecimal bd(String value) {
    return new BigDecimal(value);
  }
}
