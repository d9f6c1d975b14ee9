package com.swaptrader.execution;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.exception.ValidationException;
import java.util.Map;

/**
 * A trading symbol split into its tokens: {@code "SOL-USDC"} is base SOL, quote USDC.
 *
 * <p>Buying the base spends the quote token; selling it spends the base token.
 */
public record TokenPair(String base, String quote) {

    public static TokenPair parse(String symbol) {
        if (symbol == null) {
            throw new ValidationException("Symbol is required");
        }
        String[] parts = symbol.split("-");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ValidationException("Symbol must be BASE-QUOTE: " + symbol, Map.of("symbol", symbol));
        }
        return new TokenPair(parts[0].trim(), parts[1].trim());
    }

    public String inputToken(OrderSide side) {
        return side == OrderSide.BUY ? quote : base;
    }

    public String outputToken(OrderSide side) {
        return side == OrderSide.BUY ? base : quote;
    }

    public String symbol() {
        return base + "-" + quote;
    }
}
