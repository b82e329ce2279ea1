package com.dividendcapture.marketdata;

import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Source of historical prices and dividend events for a backtest.
 *
 * <p>{@link #loadData} is called once before the day loop; every other method is a pure
 * lookup against the loaded data and never blocks or fetches.
 */
public interface MarketDataProvider {

    /** Bulk-loads prices and dividends for the instruments over the window. */
    void loadData(List<String> instruments, LocalDate startDate, LocalDate endDate);

    /**
     * Close price on {@code date}, falling back to the most recent earlier close.
     *
     * @return empty when the instrument has no close on or before {@code date}
     */
    Optional<BigDecimal> priceOnDate(String instrument, LocalDate date);

    /** First dividend whose record date is strictly after {@code afterDate}. */
    Optional<DividendInfo> nextDividend(String instrument, LocalDate afterDate);

    /** Loaded bars in date order; empty when the instrument has none. */
    List<PriceBar> priceBars(String instrument);

    /** Loaded dividends in record-date order; empty when the instrument has none. */
    List<DividendInfo> dividends(String instrument);
}
