package com.dividendcapture.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Daily OHLCV bar. {@code close} is null when the source row had no close price. */
@Value
@Builder
public class PriceBar {

    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    public boolean hasClose() {
        return close != null;
    }
}
