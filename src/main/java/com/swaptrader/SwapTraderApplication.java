package com.swaptrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwapTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwapTraderApplication.class, args);
    }
}
