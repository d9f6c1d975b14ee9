package com.swaptrader.service;

import com.swaptrader.domain.model.Trade;
import java.util.List;

public record TradeHistory(int totalTrades, List<Trade> trades) {}
