package com.swaptrader.strategy.base;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.SuperBuilder;

/**
 * Position-sizing settings shared by all strategy types.
 *
 * <p>Entry size is a fixed risk budget: {@code (accountSize × riskFactor) / (price × assumedStopLossFraction)}.
 * Account size is configuration here, not live equity.
 */
@Data
@SuperBuilder
public class BaseStrategyConfig {

    /** Notional account size the risk budget is drawn from, in quote-token units. */
    @Builder.Default
    private BigDecimal accountSize = new BigDecimal("1000");

    /** Fraction of the account risked per entry. */
    @Builder.Default
    private BigDecimal riskFactor = new BigDecimal("0.02");

    /** Stop distance assumed when sizing, as a fraction of entry price. */
    @Builder.Default
    private BigDecimal assumedStopLossFraction = new BigDecimal("0.05");
}
