package com.swaptrader.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Trading behaviour settings. */
@Configuration
@ConfigurationProperties(prefix = "swaptrader.trading")
@Getter
@Setter
public class TradingConfig {

    /**
     * Stop distance applied to strategy entries as a fraction of the entry price.
     * Null or zero disables automatic stop-losses.
     */
    private BigDecimal defaultStopLossPercent = new BigDecimal("0.05");

    /** Whether open positions are closed (best-effort) when the system stops. */
    private boolean closePositionsOnShutdown = true;

    /** Whether the ingestion loop starts with the application context. */
    private boolean autoStart = true;

    /** Expiry of the latest-price snapshot at {@code market:{symbol}:latest}. */
    private Duration marketDataTtl = Duration.ofSeconds(60);

    /** Expiry of the latest candle at {@code market:{symbol}:candle:{interval}}. */
    private Duration candleCacheTtl = Duration.ofMinutes(5);
}
