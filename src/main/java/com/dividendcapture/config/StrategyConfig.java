package com.dividendcapture.config;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable entry, addition and exit parameters of the dividend-capture strategy.
 */
@Value
@Builder(toBuilder = true)
public class StrategyConfig {

    /** Business days before the record date on which the position is opened. */
    int daysBeforeRecord;

    /** Currency amount allocated to each new position. */
    BigDecimal positionSize;

    int maxPositions;

    /** Minimum tradable share increment. */
    @Builder.Default
    int lotSize = 100;

    boolean additionEnabled;

    /** Fraction of the initial position value bought again on the ex-dividend date. */
    BigDecimal additionRatio;

    /** When true, additions require the ex-date price to be below the pre-ex close. */
    boolean additionOnDropOnly;

    /** Business days after entry at which the position is force-exited. */
    int maxHoldingDays;

    /** Fractional drop below average cost that triggers the stop loss (0.1 = 10%). */
    BigDecimal stopLossPct;

    boolean exitOnWindowFill;

    void collectViolations(List<String> violations) {
        if (daysBeforeRecord < 0) {
            violations.add("strategy.entry.days-before-record must be >= 0");
        }
        if (positionSize == null || positionSize.signum() <= 0) {
            violations.add("strategy.entry.position-size must be positive");
        }
        if (maxPositions <= 0) {
            violations.add("strategy.entry.max-positions must be positive");
        }
        if (lotSize <= 0) {
            violations.add("strategy.entry.lot-size must be positive");
        }
        if (additionRatio == null || additionRatio.signum() < 0) {
            violations.add("strategy.addition.add-ratio must be >= 0");
        }
        if (maxHoldingDays <= 0) {
            violations.add("strategy.exit.max-holding-days must be positive");
        }
        if (stopLossPct == null || stopLossPct.signum() <= 0 || stopLossPct.compareTo(BigDecimal.ONE) >= 0) {
            violations.add("strategy.exit.stop-loss-pct must be in (0, 1)");
        }
    }
}
