package com.dividendcapture.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One announced dividend of an instrument, as supplied by the market data provider.
 * Attached to a position when it is opened and reused for the addition and payment checks.
 */
@Value
@Builder
public class DividendInfo {

    LocalDate exDividendDate;
    LocalDate recordDate;

    /** Gross dividend per share, before withholding tax. */
    BigDecimal dividendPerShare;

    /** True when all three fields are set; an incomplete dividend can neither be entered nor paid. */
    public boolean isComplete() {
        return exDividendDate != null && recordDate != null && dividendPerShare != null;
    }
}
