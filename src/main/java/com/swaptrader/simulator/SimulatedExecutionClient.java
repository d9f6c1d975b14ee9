package com.swaptrader.simulator;

import com.swaptrader.config.SimulatorConfig;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.event.Event;
import com.swaptrader.event.EventBus;
import com.swaptrader.event.EventType;
import com.swaptrader.exception.TradeExecutionException;
import com.swaptrader.execution.ExecutionClient;
import com.swaptrader.execution.Quote;
import com.swaptrader.execution.SwapResult;
import com.swaptrader.execution.TokenPair;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Paper-trading {@link ExecutionClient}: fills every swap at the last observed market price.
 *
 * <p>Prices come from {@code price_update} events on the {@link EventBus}, so the simulator
 * sees exactly what the ingestion loop saw. A fee of {@code fee-rate × notional} is charged on
 * each fill. Quoting a symbol with no observed price fails, as a real venue would with no
 * liquidity.
 */
@Component
public class SimulatedExecutionClient implements ExecutionClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionClient.class);

    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    private final EventBus eventBus;
    private final SimulatorConfig simulatorConfig;

    public SimulatedExecutionClient(EventBus eventBus, SimulatorConfig simulatorConfig) {
        this.eventBus = eventBus;
        this.simulatorConfig = simulatorConfig;
    }

    @PostConstruct
    public void subscribe() {
        eventBus.subscribe(EventType.PRICE_UPDATE, this::onPriceUpdate);
        log.info("Simulated execution enabled: feeRate={}", simulatorConfig.getFeeRate());
    }

    private void onPriceUpdate(Event event) {
        Object symbol = event.payload().get("symbol");
        Object price = event.payload().get("price");
        if (symbol != null && price != null) {
            updatePrice(symbol.toString(), new BigDecimal(price.toString()));
        }
    }

    public void updatePrice(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
    }

    public Optional<BigDecimal> getLastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    @Override
    public Quote getQuote(String inputToken, String outputToken, BigDecimal amount, OrderSide side) {
        String symbol = side == OrderSide.BUY
                ? new TokenPair(outputToken, inputToken).symbol()
                : new TokenPair(inputToken, outputToken).symbol();
        BigDecimal price = lastPrices.get(symbol);
        if (price == null) {
            throw new TradeExecutionException("No market price for " + symbol);
        }
        BigDecimal fee = price.multiply(amount).multiply(simulatorConfig.getFeeRate()).setScale(8, RoundingMode.HALF_UP);
        log.debug("Quote: symbol={}, side={}, amount={}, price={}, fee={}", symbol, side, amount, price, fee);
        return new Quote(inputToken, outputToken, side, amount, price, fee, Instant.now());
    }

    @Override
    public SwapResult executeSwap(Quote quote) {
        String transactionId = "sim_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        log.info(
                "Simulated swap: txId={}, {} -> {}, amount={}, price={}",
                transactionId,
                quote.inputToken(),
                quote.outputToken(),
                quote.amount(),
                quote.price());
        return new SwapResult(quote.price(), quote.amount(), quote.fee(), transactionId);
    }
}
