package com.dividendcapture.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * End-of-day mark-to-market of the portfolio. {@code dailyReturn} is relative to the
 * previous snapshot's total value (0 for the first), {@code cumulativeReturn} relative to
 * the initial capital.
 */
@Value
@Builder
@JsonPropertyOrder({
    "date",
    "cash",
    "positionsMarketValue",
    "totalValue",
    "dailyReturn",
    "cumulativeReturn",
    "openPositionCount"
})
public class DailySnapshot {

    LocalDate date;
    BigDecimal cash;
    BigDecimal positionsMarketValue;
    BigDecimal totalValue;
    double dailyReturn;
    double cumulativeReturn;
    int openPositionCount;
}
