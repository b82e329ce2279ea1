package com.dividendcapture.config;

import com.dividendcapture.domain.enums.DividendPaymentPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code dividend-capture.*} section of application.yml.
 *
 * <p>Unknown keys fail startup instead of being ignored, and every numeric knob is
 * required. Defaults live in application.yml, not here, so a missing key surfaces as a
 * binding error rather than a silent fallback. {@link #toConfig()} converts the bound
 * values into the immutable {@link BacktestConfig} consumed by the engine.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "dividend-capture", ignoreUnknownFields = false)
public class BacktestProperties {

    @Valid
    @NotNull
    private Backtest backtest = new Backtest();

    @Valid
    @NotNull
    private Universe universe = new Universe();

    @Valid
    @NotNull
    private Strategy strategy = new Strategy();

    @Valid
    @NotNull
    private Execution execution = new Execution();

    @Valid
    @NotNull
    private Dividend dividend = new Dividend();

    @Valid
    @NotNull
    private MarketData data = new MarketData();

    @Valid
    @NotNull
    private Output output = new Output();

    @NotNull
    private Runner runner = new Runner();

    @Data
    public static class Backtest {
        @NotNull
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate startDate;

        @NotNull
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate endDate;

        @NotNull
        private BigDecimal initialCapital;
    }

    @Data
    public static class Universe {
        @NotEmpty
        private List<String> tickers = new ArrayList<>();
    }

    @Data
    public static class Strategy {
        @Valid
        @NotNull
        private Entry entry = new Entry();

        @Valid
        @NotNull
        private Addition addition = new Addition();

        @Valid
        @NotNull
        private Exit exit = new Exit();
    }

    @Data
    public static class Entry {
        @NotNull
        private Integer daysBeforeRecord;

        @NotNull
        private BigDecimal positionSize;

        @NotNull
        private Integer maxPositions;

        @NotNull
        private Integer lotSize;
    }

    @Data
    public static class Addition {
        @NotNull
        private Boolean enabled;

        @NotNull
        private BigDecimal addRatio;

        @NotNull
        private Boolean addOnDrop;
    }

    @Data
    public static class Exit {
        @NotNull
        private Integer maxHoldingDays;

        @NotNull
        private BigDecimal stopLossPct;

        @NotNull
        private Boolean takeProfitOnWindowFill;
    }

    @Data
    public static class Execution {
        @NotNull
        private BigDecimal slippage;

        @NotNull
        private BigDecimal slippageExDate;

        @NotNull
        private BigDecimal commission;

        @NotNull
        private BigDecimal minCommission;

        @NotNull
        private BigDecimal maxCommission;

        @NotNull
        private BigDecimal taxRate;
    }

    @Data
    public static class Dividend {
        @NotNull
        private DividendPaymentPolicy paymentPolicy;

        @NotNull
        private Integer paymentOffsetDays;

        @NotNull
        private Integer fallbackPaymentDays;
    }

    @Data
    public static class MarketData {
        @NotNull
        private String directory;
    }

    @Data
    public static class Output {
        @NotNull
        private String resultsDir;

        @NotNull
        private Set<String> formats = new LinkedHashSet<>();

        @NotNull
        private Boolean saveTrades;

        @NotNull
        private Boolean savePortfolioHistory;
    }

    @Data
    public static class Runner {
        /** Runs one backtest at startup and exits with its status code. */
        private boolean enabled;
    }

    /**
     * Converts the bound properties into a validated {@link BacktestConfig}.
     *
     * @throws com.dividendcapture.exception.ConfigValidationException if any value is out of range
     */
    public BacktestConfig toConfig() {
        return BacktestConfig.builder()
                .startDate(backtest.getStartDate())
                .endDate(backtest.getEndDate())
                .initialCapital(backtest.getInitialCapital())
                .tickers(List.copyOf(universe.getTickers()))
                .strategy(StrategyConfig.builder()
                        .daysBeforeRecord(strategy.getEntry().getDaysBeforeRecord())
                        .positionSize(strategy.getEntry().getPositionSize())
                        .maxPositions(strategy.getEntry().getMaxPositions())
                        .lotSize(strategy.getEntry().getLotSize())
                        .additionEnabled(strategy.getAddition().getEnabled())
                        .additionRatio(strategy.getAddition().getAddRatio())
                        .additionOnDropOnly(strategy.getAddition().getAddOnDrop())
                        .maxHoldingDays(strategy.getExit().getMaxHoldingDays())
                        .stopLossPct(strategy.getExit().getStopLossPct())
                        .exitOnWindowFill(strategy.getExit().getTakeProfitOnWindowFill())
                        .build())
                .execution(ExecutionConfig.builder()
                        .slippage(execution.getSlippage())
                        .slippageExDate(execution.getSlippageExDate())
                        .commissionRate(execution.getCommission())
                        .minCommission(execution.getMinCommission())
                        .maxCommission(execution.getMaxCommission())
                        .dividendTaxRate(execution.getTaxRate())
                        .build())
                .dividend(DividendPaymentConfig.builder()
                        .policy(dividend.getPaymentPolicy())
                        .paymentOffsetDays(dividend.getPaymentOffsetDays())
                        .fallbackPaymentDays(dividend.getFallbackPaymentDays())
                        .build())
                .dataDirectory(data.getDirectory())
                .output(OutputConfig.builder()
                        .resultsDir(output.getResultsDir())
                        .formats(Set.copyOf(output.getFormats()))
                        .saveTrades(output.getSaveTrades())
                        .savePortfolioHistory(output.getSavePortfolioHistory())
                        .build())
                .build()
                .validate();
    }
}
