package com.dividendcapture.unit;

import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.config.DividendPaymentConfig;
import com.dividendcapture.config.ExecutionConfig;
import com.dividendcapture.config.OutputConfig;
import com.dividendcapture.config.StrategyConfig;
import com.dividendcapture.domain.enums.DividendPaymentPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/** Builders for the default configuration used across the unit tests. */
public final class TestConfigs {

    private TestConfigs() {}

    public static StrategyConfig strategy() {
        return StrategyConfig.builder()
                .daysBeforeRecord(3)
                .positionSize(new BigDecimal("1000000"))
                .maxPositions(10)
                .lotSize(100)
                .additionEnabled(true)
                .additionRatio(new BigDecimal("0.5"))
                .additionOnDropOnly(true)
                .maxHoldingDays(20)
                .stopLossPct(new BigDecimal("0.1"))
                .exitOnWindowFill(true)
                .build();
    }

    public static ExecutionConfig execution() {
        return ExecutionConfig.builder()
                .slippage(new BigDecimal("0.002"))
                .slippageExDate(new BigDecimal("0.005"))
                .commissionRate(new BigDecimal("0.00055"))
                .minCommission(new BigDecimal("550"))
                .maxCommission(new BigDecimal("1100"))
                .dividendTaxRate(new BigDecimal("0.20315"))
                .build();
    }

    /** No slippage, no commission, no tax: fills equal closes. */
    public static ExecutionConfig frictionless() {
        return ExecutionConfig.builder()
                .slippage(BigDecimal.ZERO)
                .slippageExDate(BigDecimal.ZERO)
                .commissionRate(BigDecimal.ZERO)
                .minCommission(BigDecimal.ZERO)
                .maxCommission(BigDecimal.ZERO)
                .dividendTaxRate(BigDecimal.ZERO)
                .build();
    }

    public static DividendPaymentConfig exDatePayment() {
        return DividendPaymentConfig.builder().policy(DividendPaymentPolicy.EX_DATE).build();
    }

    public static BacktestConfig.BacktestConfigBuilder backtest(LocalDate start, LocalDate end, String... tickers) {
        return BacktestConfig.builder()
                .startDate(start)
                .endDate(end)
                .initialCapital(new BigDecimal("10000000"))
                .tickers(List.of(tickers))
                .strategy(strategy())
                .execution(execution())
                .dividend(exDatePayment())
                .dataDirectory("./data")
                .output(OutputConfig.builder()
                        .resultsDir("./data/results")
                        .formats(Set.of("json", "csv"))
                        .saveTrades(true)
                        .savePortfolioHistory(true)
                        .build());
    }
}
