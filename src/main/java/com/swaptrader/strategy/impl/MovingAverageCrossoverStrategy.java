package com.swaptrader.strategy.impl;

import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.SignalType;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.Candle;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.exception.ValidationException;
import com.swaptrader.indicator.CandleSeries;
import com.swaptrader.repository.StrategyStateRepository;
import com.swaptrader.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.num.Num;

/**
 * Fast/slow simple moving average crossover on candle closes.
 *
 * <p><b>Indicators:</b> candles go into a ta4j bar series capped at {@code 2 × max(fast, slow)}
 * bars; both averages are ta4j {@link SMAIndicator}s over the close. A crossover compares the
 * averages at the last two bars, so it needs {@code max(fast, slow) + 1} bars.
 *
 * <p><b>Signal:</b> with {@code diff = fastMA − slowMA}, a move from {@code diff <= 0} to
 * {@code diff > 0} is a bullish cross (BUY entry) and a move from {@code diff >= 0} to
 * {@code diff < 0} a bearish one (SELL entry). The last cross direction is remembered, so a
 * signal fires only when the direction actually changes. No signal while the latest volume is
 * below {@code minVolume}.
 *
 * <p><b>Strategy validation:</b> enough data, volume at or above the minimum, and the last
 * close moved in the signal's direction.
 */
public class MovingAverageCrossoverStrategy extends BaseStrategy {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageCrossoverStrategy.class);

    private static final double SIGNAL_CONFIDENCE = 0.8;

    private enum Cross {
        UP,
        DOWN,
        NONE
    }

    private final MovingAverageCrossoverConfig config;
    private final int maxPeriod;

    private CandleSeries candles;
    private ClosePriceIndicator closePrice;
    private VolumeIndicator volume;
    private SMAIndicator fastSma;
    private SMAIndicator slowSma;

    private BigDecimal lastClose;
    private Cross lastCross = Cross.NONE;

    public MovingAverageCrossoverStrategy(
            String id,
            String symbol,
            MovingAverageCrossoverConfig config,
            StrategyStateRepository strategyStateRepository) {
        super(id, symbol, config, strategyStateRepository);
        if (config.getFastPeriod() <= 0 || config.getSlowPeriod() <= 0) {
            throw new ValidationException("Moving average periods must be positive");
        }
        if (config.getFastPeriod() >= config.getSlowPeriod()) {
            throw new ValidationException(
                    "Fast period must be shorter than slow period",
                    Map.of("fastPeriod", config.getFastPeriod(), "slowPeriod", config.getSlowPeriod()));
        }
        this.config = config;
        this.maxPeriod = Math.max(config.getFastPeriod(), config.getSlowPeriod());
        resetIndicators();
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MA_CROSSOVER;
    }

    @Override
    protected void onInitialize() {
        lastCross = Cross.NONE;
        log.info(
                "MA crossover ready: strategyId={}, symbol={}, fast={}, slow={}, minVolume={}",
                id,
                symbol,
                config.getFastPeriod(),
                config.getSlowPeriod(),
                config.getMinVolume());
    }

    @Override
    protected void onCleanup() {
        resetIndicators();
        lastClose = null;
        lastCross = Cross.NONE;
    }

    @Override
    public void processData(DataPoint dataPoint) {
        if (dataPoint.getDataType() != DataType.CANDLE) {
            return;
        }
        if (!(dataPoint.getValue() instanceof Candle candle)) {
            log.warn("Candle point without candle value ignored: strategyId={}, value={}", id, dataPoint.getValue());
            return;
        }
        candles.addCandle(dataPoint.getTimestamp(), candle);
        lastClose = candle.close();
    }

    @Override
    public Optional<Signal> generateSignal() {
        if (!isActive()) {
            return Optional.empty();
        }
        if (candles.getBarCount() < maxPeriod + 1) {
            return Optional.empty();
        }
        int end = candles.getEndIndex();
        if (latestVolume() < config.getMinVolume()) {
            return Optional.empty();
        }

        Num fastMa = fastSma.getValue(end);
        Num slowMa = slowSma.getValue(end);
        Num previousDiff = fastSma.getValue(end - 1).minus(slowSma.getValue(end - 1));
        Num currentDiff = fastMa.minus(slowMa);

        OrderSide side = null;
        if (previousDiff.isNegativeOrZero() && currentDiff.isPositive()) {
            if (lastCross != Cross.UP) {
                side = OrderSide.BUY;
                lastCross = Cross.UP;
            }
        } else if (previousDiff.isPositiveOrZero() && currentDiff.isNegative()) {
            if (lastCross != Cross.DOWN) {
                side = OrderSide.SELL;
                lastCross = Cross.DOWN;
            }
        }
        if (side == null) {
            return Optional.empty();
        }

        Signal signal = createSignal(side, fastMa.doubleValue(), slowMa.doubleValue());
        recordLastSignal(signal);
        log.info(
                "Crossover signal: strategyId={}, side={}, price={}, size={}, fastMa={}, slowMa={}",
                id,
                side,
                signal.getPrice(),
                signal.getSize(),
                fastMa,
                slowMa);
        return Optional.of(signal);
    }

    @Override
    protected boolean validateStrategySignal(Signal signal) {
        if (candles.getBarCount() < Math.max(maxPeriod, 2)) {
            return false;
        }
        if (latestVolume() < config.getMinVolume()) {
            return false;
        }
        int end = candles.getEndIndex();
        Num priceChange = closePrice.getValue(end).minus(closePrice.getValue(end - 1));
        if (signal.getSide() == OrderSide.BUY && priceChange.isNegative()) {
            return false;
        }
        return !(signal.getSide() == OrderSide.SELL && priceChange.isPositive());
    }

    private double latestVolume() {
        return volume.getValue(candles.getEndIndex()).doubleValue();
    }

    private void resetIndicators() {
        candles = new CandleSeries(id, maxPeriod * 2);
        closePrice = new ClosePriceIndicator(candles.getBarSeries());
        volume = new VolumeIndicator(candles.getBarSeries());
        fastSma = new SMAIndicator(closePrice, config.getFastPeriod());
        slowSma = new SMAIndicator(closePrice, config.getSlowPeriod());
    }

    private Signal createSignal(OrderSide side, double fastMa, double slowMa) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("fast_ma", fastMa);
        metadata.put("slow_ma", slowMa);
        metadata.put("risk_factor", config.getRiskFactor().toPlainString());
        return Signal.builder()
                .strategyId(id)
                .symbol(symbol)
                .side(side)
                .size(calculatePositionSize(lastClose))
                .price(lastClose)
                .signalType(SignalType.ENTRY)
                .confidence(SIGNAL_CONFIDENCE)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }

    private void recordLastSignal(Signal signal) {
        Map<String, Object> lastSignal = new LinkedHashMap<>();
        lastSignal.put("side", signal.getSide().getValue());
        lastSignal.put("price", signal.getPrice().toPlainString());
        lastSignal.put("timestamp", signal.getTimestamp().toString());
        updateState(s -> s.getMetadata().put("last_signal", lastSignal));
    }
}
