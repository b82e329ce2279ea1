package com.dividendcapture.exception;

import com.dividendcapture.marketdata.DataValidationReport;
import java.util.Map;

/**
 * Fatal pre-run failure: at least one instrument has no usable price series.
 *
 * <p>Carries the full validation report so the caller can show every error (and the
 * non-fatal warnings collected alongside them) that caused the abort.
 */
public class DataValidationException extends BaseException {

    private final DataValidationReport report;

    public DataValidationException(DataValidationReport report) {
        super(
                ErrorCode.DATA_VALIDATION_FAILED,
                "Data validation failed: " + String.join("; ", report.getErrors()),
                Map.of("errors", report.getErrors(), "warnings", report.getWarnings()));
        this.report = report;
    }

    public DataValidationReport getReport() {
        return report;
    }
}
