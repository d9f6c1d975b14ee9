package com.swaptrader.execution;

import com.swaptrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;

/** Price commitment returned by {@link ExecutionClient#getQuote}. {@code price} is quote-token per base-token. */
public record Quote(
        String inputToken,
        String outputToken,
        OrderSide side,
        BigDecimal amount,
        BigDecimal price,
        BigDecimal fee,
        Instant quotedAt) {}
