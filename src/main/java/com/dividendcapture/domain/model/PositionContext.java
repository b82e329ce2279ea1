package com.dividendcapture.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of an open position handed to the strategy, so every decision can be
 * reproduced from its inputs.
 */
@Value
@Builder
public class PositionContext {

    String instrument;
    LocalDate entryDate;
    BigDecimal entryPrice;
    BigDecimal averagePrice;
    int totalShares;

    /** Entry price x opening share count. Additions are sized from this. */
    BigDecimal initialValue;

    LocalDate exDividendDate;

    /** Close on the business day before the ex-dividend date; null until that date is reached. */
    BigDecimal preExPrice;
}
