package com.swaptrader.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/** Read-only projection of all live (OPEN or CLOSING) positions. */
@Value
@Builder
public class PositionSummary {

    int totalPositions;
    BigDecimal totalUnrealizedPnl;
    Set<String> activeSymbols;
    List<Position> positions;
}
