package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Optional predicates over the anomaly set, combined with AND. A single {@code symbol}
 * takes precedence over {@code symbols}; date bounds are inclusive.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyFilter {
    private String symbol;
    private Set<String> symbols;
    private AnomalyType type;
    private ValidationStatus validationStatus;
    private Instant startDate;
    private Instant endDate;

    public static AnomalyFilter none() {
        return new AnomalyFilter();
    }

    public static AnomalyFilter forSymbols(Set<String> symbols) {
        return AnomalyFilter.builder().symbols(symbols).build();
    }

    public boolean matchesSymbol(String candidate) {
        if (symbol != null && !symbol.isBlank()) {
            return symbol.equals(candidate);
        }
        if (symbols != null && !symbols.isEmpty()) {
            return symbols.contains(candidate);
        }
        return true;
    }

    public boolean matchesDetectedAt(Instant detectedAt) {
        if (startDate != null && detectedAt.isBefore(startDate)) return false;
        if (endDate != null && detectedAt.isAfter(endDate)) return false;
        return true;
    }

    public boolean matchesType(AnomalyType candidate) {
        return type == null || type == candidate;
    }

    /**
     * Predicates answerable from the anomaly row alone, before narratives are joined.
     */
    public boolean matchesRow(Anomaly anomaly) {
        return matchesSymbol(anomaly.getSymbol())
                && matchesDetectedAt(anomaly.getDetectedAt())
                && matchesType(anomaly.getType());
    }

    public boolean matchesNarrative(Narrative narrative) {
        return validationStatus == null || validationStatus.matches(narrative);
    }

    public boolean requiresNarratives() {
        return validationStatus != null;
    }
}
