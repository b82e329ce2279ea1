package com.dividendcapture.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised when a backtest configuration is missing fields or carries out-of-range values.
 * The run never starts with an invalid configuration.
 */
public class ConfigValidationException extends BaseException {

    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super(
                ErrorCode.CONFIG_INVALID,
                "Invalid backtest configuration: " + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
