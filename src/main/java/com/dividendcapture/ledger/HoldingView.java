package com.dividendcapture.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Read-only view of one open position. */
@Value
@Builder
public class HoldingView {

    String instrument;
    int shares;
    BigDecimal averageCost;
    BigDecimal costBasis;
    LocalDate entryDate;
    LocalDate exDividendDate;
}
