package com.swaptrader.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Paper-execution settings for {@link com.swaptrader.simulator.SimulatedExecutionClient}. */
@Configuration
@ConfigurationProperties(prefix = "swaptrader.simulator")
@Getter
@Setter
public class SimulatorConfig {

    /** Fee charged per swap as a fraction of notional (0.003 = 0.3%). */
    private BigDecimal feeRate = new BigDecimal("0.003");
}
