package com.dividendcapture.config;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable execution cost parameters: slippage, commission schedule and dividend tax.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionConfig {

    /** Fractional price slippage applied against the trader on normal days. */
    BigDecimal slippage;

    /** Slippage used instead of {@link #slippage} on the instrument's ex-dividend date. */
    BigDecimal slippageExDate;

    /** Commission as a fraction of notional. */
    BigDecimal commissionRate;

    BigDecimal minCommission;
    BigDecimal maxCommission;

    /** Withholding tax applied to gross dividends before they are credited. */
    BigDecimal dividendTaxRate;

    void collectViolations(List<String> violations) {
        requireFraction(violations, slippage, "execution.slippage");
        requireFraction(violations, slippageExDate, "execution.slippage-ex-date");
        requireFraction(violations, commissionRate, "execution.commission");
        requireFraction(violations, dividendTaxRate, "execution.tax-rate");
        if (minCommission == null || minCommission.signum() < 0) {
            violations.add("execution.min-commission must be >= 0");
        }
        if (maxCommission == null || maxCommission.signum() < 0) {
            violations.add("execution.max-commission must be >= 0");
        } else if (minCommission != null && maxCommission.compareTo(minCommission) < 0) {
            violations.add("execution.max-commission must be >= execution.min-commission");
        }
    }

    private static void requireFraction(List<String> violations, BigDecimal value, String name) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) >= 0) {
            violations.add(name + " must be in [0, 1)");
        }
    }
}
