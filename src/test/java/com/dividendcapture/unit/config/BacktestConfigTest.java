package com.dividendcapture.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.exception.ConfigValidationException;
import com.dividendcapture.exception.ErrorCode;
import com.dividendcapture.unit.TestConfigs;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BacktestConfigTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 4);
    private static final LocalDate END = LocalDate.of(2023, 12, 29);

    @Test
    @DisplayName("Valid configuration passes and returns itself")
    void validConfig() {
        BacktestConfig config = TestConfigs.backtest(START, END, "7203", "6758").build();
        assertThat(config.validate()).isSameAs(config);
    }

    @Test
    @DisplayName("End date before start date is rejected")
    void endBeforeStart() {
        BacktestConfig config = TestConfigs.backtest(END, START, "7203").build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigValidationException.class)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getViolations())
                        .contains("backtest.end-date must not be before backtest.start-date"));
    }

    @Test
    @DisplayName("Empty and duplicate universes are rejected")
    void universeChecks() {
        BacktestConfig empty = TestConfigs.backtest(START, END).build();
        BacktestConfig duplicated = TestConfigs.backtest(START, END, "7203", "7203").build();

        assertThatThrownBy(empty::validate)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getViolations())
                        .contains("universe.tickers must not be empty"));
        assertThatThrownBy(duplicated::validate)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getViolations())
                        .contains("universe.tickers must not contain duplicates"));
    }

    @Test
    @DisplayName("Every violation is reported at once")
    void collectsAllViolations() {
        BacktestConfig config = TestConfigs.backtest(START, END, "7203")
                .initialCapital(BigDecimal.ZERO)
                .execution(TestConfigs.execution().toBuilder().slippage(new BigDecimal("1.5")).build())
                .build();

        ConfigValidationException thrown = null;
        try {
            config.validate();
        } catch (ConfigValidationException e) {
            thrown = e;
        }

        assertThat(thrown).isNotNull();
        List<String> violations = thrown.getViolations();
        assertThat(violations).contains(
                "backtest.initial-capital must be positive",
                "execution.slippage must be in [0, 1)");
        assertThat(thrown.getErrorCode()).isEqualTo(ErrorCode.CONFIG_INVALID);
        assertThat(thrown.getErrorCode().getExitCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("Stop loss outside (0, 1) is rejected")
    void stopLossRange() {
        BacktestConfig config = TestConfigs.backtest(START, END, "7203")
                .strategy(TestConfigs.strategy().toBuilder().stopLossPct(BigDecimal.ONE).build())
                .build();

        assertThatThrownBy(config::validate)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getViolations())
                        .contains("strategy.exit.stop-loss-pct must be in (0, 1)"));
    }
}
