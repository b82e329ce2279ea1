package com.dividendcapture.marketdata;

import java.util.List;
import lombok.Value;

/**
 * Outcome of validating loaded market data. Errors are fatal to a run; warnings are logged
 * and the run continues.
 */
@Value
public class DataValidationReport {

    List<String> errors;
    List<String> warnings;

    public DataValidationReport(List<String> errors, List<String> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
