package com.swaptrader.execution;

import com.swaptrader.domain.enums.OrderSide;
import java.math.BigDecimal;

/**
 * Quote/execute contract against the trading venue. The venue's swap mechanics are opaque to
 * this core; any failure surfaces as a {@link com.swaptrader.exception.TradeExecutionException}.
 *
 * <p>No timeout is imposed by callers. An implementation that can stall must enforce its own.
 */
public interface ExecutionClient {

    /**
     * @param inputToken  token given up by the swap
     * @param outputToken token received
     * @param amount      order size in base-token units
     * @param side        side of the order from the base token's point of view
     */
    Quote getQuote(String inputToken, String outputToken, BigDecimal amount, OrderSide side);

    SwapResult executeSwap(Quote quote);
}
