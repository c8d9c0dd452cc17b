package com.market.anomaly.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Symbols the API serves, with display names. Order is kept for listing.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "market")
public class SymbolsConfig {

    private List<SymbolDefinition> symbols = new ArrayList<>();

    public Optional<SymbolDefinition> find(String symbol) {
        return symbols.stream()
                .filter(s -> s.getSymbol().equalsIgnoreCase(symbol))
                .findFirst();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SymbolDefinition {
        private String symbol;
        private String name;
    }
}
