package com.market.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketAnomalyQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketAnomalyQueryApplication.class, args);
    }
}
