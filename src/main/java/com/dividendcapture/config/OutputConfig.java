package com.dividendcapture.config;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OutputConfig {

    String resultsDir;

    /** Any of "json" (metrics) and "csv" (trades, positions, portfolio history, signals). */
    Set<String> formats;

    boolean saveTrades;
    boolean savePortfolioHistory;

    public boolean writesJson() {
        return formats != null && formats.contains("json");
    }

    public boolean writesCsv() {
        return formats != null && formats.contains("csv");
    }
}
