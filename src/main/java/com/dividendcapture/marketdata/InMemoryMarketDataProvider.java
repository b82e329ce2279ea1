package com.dividendcapture.marketdata;

import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Market data held in memory, keyed by instrument.
 *
 * <p>Bars are stored in a date-ordered map so that {@link #priceOnDate} can walk back to the
 * latest close on or before the requested date. Bars without a close are kept (the
 * validator reports them) but never returned as a price.
 */
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataProvider.class);

    private final Map<String, NavigableMap<LocalDate, PriceBar>> barsByInstrument = new HashMap<>();
    private final Map<String, List<DividendInfo>> dividendsByInstrument = new HashMap<>();

    /** Adds or replaces bars for an instrument; later bars for the same date win. */
    public InMemoryMarketDataProvider putPriceBars(String instrument, List<PriceBar> bars) {
        NavigableMap<LocalDate, PriceBar> series = barsByInstrument.computeIfAbsent(instrument, k -> new TreeMap<>());
        for (PriceBar bar : bars) {
            series.put(bar.getDate(), bar);
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException if a dividend lacks its ex-date, record date or amount
     */
    public InMemoryMarketDataProvider putDividends(String instrument, List<DividendInfo> dividends) {
        for (DividendInfo dividend : dividends) {
            if (dividend == null || !dividend.isComplete()) {
                throw new IllegalArgumentException("Incomplete dividend for " + instrument + ": " + dividend);
            }
        }
        List<DividendInfo> events = dividendsByInstrument.computeIfAbsent(instrument, k -> new ArrayList<>());
        events.addAll(dividends);
        events.sort(Comparator.comparing(DividendInfo::getRecordDate));
        return this;
    }

    @Override
    public void loadData(List<String> instruments, LocalDate startDate, LocalDate endDate) {
        long loaded = instruments.stream().filter(barsByInstrument::containsKey).count();
        log.info("In-memory market data: {}/{} instruments have prices for {} to {}",
                loaded, instruments.size(), startDate, endDate);
    }

    @Override
    public Optional<BigDecimal> priceOnDate(String instrument, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = barsByInstrument.get(instrument);
        if (series == null) {
            return Optional.empty();
        }
        for (PriceBar bar : series.headMap(date, true).descendingMap().values()) {
            if (bar.hasClose()) {
                return Optional.of(bar.getClose());
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<DividendInfo> nextDividend(String instrument, LocalDate afterDate) {
        return dividends(instrument).stream()
                .filter(d -> d.getRecordDate().isAfter(afterDate))
                .findFirst();
    }

    @Override
    public List<PriceBar> priceBars(String instrument) {
        NavigableMap<LocalDate, PriceBar> series = barsByInstrument.get(instrument);
        return series == null ? List.of() : List.copyOf(series.values());
    }

    @Override
    public List<DividendInfo> dividends(String instrument) {
        List<DividendInfo> events = dividendsByInstrument.get(instrument);
        return events == null ? List.of() : List.copyOf(events);
    }
}
