package com.dividendcapture.config;

import com.dividendcapture.exception.ConfigValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable, validated configuration of one backtest run.
 *
 * <p>Built from {@link BacktestProperties} by the application, or directly through the
 * builder in tests. {@link #validate()} must pass before the engine accepts the value;
 * it reports every violation at once rather than stopping at the first.
 */
@Value
@Builder(toBuilder = true)
public class BacktestConfig {

    LocalDate startDate;
    LocalDate endDate;
    BigDecimal initialCapital;

    /** Universe in processing order. */
    List<String> tickers;

    StrategyConfig strategy;
    ExecutionConfig execution;
    DividendPaymentConfig dividend;

    /** Directory holding the per-instrument CSV files. */
    String dataDirectory;

    OutputConfig output;

    /**
     * Checks every field and throws {@link ConfigValidationException} listing all violations.
     *
     * @return this config, for chaining
     */
    public BacktestConfig validate() {
        List<String> violations = new ArrayList<>();

        if (startDate == null) {
            violations.add("backtest.start-date is required");
        }
        if (endDate == null) {
            violations.add("backtest.end-date is required");
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            violations.add("backtest.end-date must not be before backtest.start-date");
        }
        if (initialCapital == null || initialCapital.signum() <= 0) {
            violations.add("backtest.initial-capital must be positive");
        }
        if (tickers == null || tickers.isEmpty()) {
            violations.add("universe.tickers must not be empty");
        } else if (new HashSet<>(tickers).size() != tickers.size()) {
            violations.add("universe.tickers must not contain duplicates");
        }

        if (strategy == null) {
            violations.add("strategy is required");
        } else {
            strategy.collectViolations(violations);
        }
        if (execution == null) {
            violations.add("execution is required");
        } else {
            execution.collectViolations(violations);
        }
        if (dividend == null) {
            violations.add("dividend is required");
        } else {
            dividend.collectViolations(violations);
        }

        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
        return this;
    }
}
