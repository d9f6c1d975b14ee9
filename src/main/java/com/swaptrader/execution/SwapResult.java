package com.swaptrader.execution;

import java.math.BigDecimal;

/** Fill reported by {@link ExecutionClient#executeSwap}. */
public record SwapResult(BigDecimal price, BigDecimal size, BigDecimal fee, String transactionId) {}
