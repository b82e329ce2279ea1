package com.dividendcapture.marketdata;

import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PriceBar;
import com.dividendcapture.exception.MarketDataException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads per-instrument CSV files from a data directory.
 *
 * <p>Expected files, with a header row:
 * <ul>
 *   <li>{@code <ticker>_prices.csv}: date,open,high,low,close,volume</li>
 *   <li>{@code <ticker>_dividends.csv}: ex_dividend_date,record_date,dividend_amount</li>
 * </ul>
 * A missing price file leaves the instrument without data (the validator turns that into
 * an error). A missing dividend file means no dividends. A blank record date is derived
 * from the ex-dividend date with the T+2 settlement rule. Bars dated after the end of the
 * window are dropped; earlier bars are kept so pre-window closes remain available.
 */
public class CsvMarketDataLoader implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvMarketDataLoader.class);

    private final Path directory;
    private final DividendDateCalculator dividendDateCalculator;
    private final CsvMapper csvMapper = new CsvMapper();
    private InMemoryMarketDataProvider store = new InMemoryMarketDataProvider();

    public CsvMarketDataLoader(Path directory, DividendDateCalculator dividendDateCalculator) {
        this.directory = directory;
        this.dividendDateCalculator = dividendDateCalculator;
    }

    @Override
    public void loadData(List<String> instruments, LocalDate startDate, LocalDate endDate) {
        log.info("Loading data for {} tickers from {} to {} ({})", instruments.size(), startDate, endDate, directory);
        store = new InMemoryMarketDataProvider();
        for (String instrument : instruments) {
            List<PriceBar> bars = readPrices(instrument, endDate);
            List<DividendInfo> dividends = readDividends(instrument);
            store.putPriceBars(instrument, bars).putDividends(instrument, dividends);
            log.debug("{}: {} bars, {} dividends", instrument, bars.size(), dividends.size());
        }
        log.info("Data loading completed");
    }

    @Override
    public Optional<BigDecimal> priceOnDate(String instrument, LocalDate date) {
        return store.priceOnDate(instrument, date);
    }

    @Override
    public Optional<DividendInfo> nextDividend(String instrument, LocalDate afterDate) {
        return store.nextDividend(instrument, afterDate);
    }

    @Override
    public List<PriceBar> priceBars(String instrument) {
        return store.priceBars(instrument);
    }

    @Override
    public List<DividendInfo> dividends(String instrument) {
        return store.dividends(instrument);
    }

    List<PriceBar> readPrices(String instrument, LocalDate endDate) {
        Path file = directory.resolve(instrument + "_prices.csv");
        if (!Files.exists(file)) {
            log.warn("No price file for {}: {}", instrument, file);
            return List.of();
        }
        List<PriceBar> bars = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            LocalDate date = parseDate(row.get("date"), file);
            if (date == null || date.isAfter(endDate)) {
                continue;
            }
            bars.add(PriceBar.builder()
                    .date(date)
                    .open(parseDecimal(row.get("open"), file))
                    .high(parseDecimal(row.get("high"), file))
                    .low(parseDecimal(row.get("low"), file))
                    .close(parseDecimal(row.get("close"), file))
                    .volume(parseVolume(row.get("volume"), file))
                    .build());
        }
        return bars;
    }

    List<DividendInfo> readDividends(String instrument) {
        Path file = directory.resolve(instrument + "_dividends.csv");
        if (!Files.exists(file)) {
            return List.of();
        }
        List<DividendInfo> dividends = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            LocalDate exDate = parseDate(row.get("ex_dividend_date"), file);
            BigDecimal amount = parseDecimal(row.get("dividend_amount"), file);
            if (exDate == null || amount == null) {
                log.warn("Skipping incomplete dividend row in {}: {}", file, row);
                continue;
            }
            LocalDate recordDate = parseDate(row.get("record_date"), file);
            if (recordDate == null) {
                recordDate = dividendDateCalculator.recordDateFromExDate(exDate);
            }
            dividends.add(DividendInfo.builder()
                    .exDividendDate(exDate)
                    .recordDate(recordDate)
                    .dividendPerShare(amount)
                    .build());
        }
        return dividends;
    }

    private List<Map<String, String>> readRows(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it =
                csvMapper.readerForMapOf(String.class).with(schema).readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new MarketDataException("Failed to read " + file, e);
        }
    }

    private static LocalDate parseDate(String value, Path file) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
        } catch (DateTimeParseException e) {
            throw new MarketDataException("Invalid date '" + value + "' in " + file, e);
        }
    }

    private static BigDecimal parseDecimal(String value, Path file) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("nan")) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MarketDataException("Invalid number '" + value + "' in " + file, e);
        }
    }

    private static long parseVolume(String value, Path file) {
        BigDecimal volume = parseDecimal(value, file);
        return volume == null ? 0L : volume.longValue();
    }
}
