package com.dividendcapture.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PriceBar;
import com.dividendcapture.exception.MarketDataException;
import com.dividendcapture.marketdata.CsvMarketDataLoader;
import com.dividendcapture.unit.TestCalendars;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for CsvMarketDataLoader reading price and dividend files from a directory.
 */
class CsvMarketDataLoaderTest {

    private static final LocalDate START = LocalDate.of(2023, 3, 27);
    private static final LocalDate END = LocalDate.of(2023, 3, 31);

    @TempDir
    Path dataDir;

    private CsvMarketDataLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CsvMarketDataLoader(dataDir, TestCalendars.dividendDates(TestCalendars.tse2023()));
    }

    @Test
    @DisplayName("Loads bars up to the end date and treats blank or nan closes as missing")
    void loadsPrices() throws IOException {
        Files.writeString(dataDir.resolve("7203_prices.csv"), String.join("\n",
                "date,open,high,low,close,volume",
                "2023-03-24,1990,2010,1980,2000,1000000",
                "2023-03-27,2000,2020,1990,2010,1100000",
                "2023-03-28,2010,2030,2000,,900000",
                "2023-03-29,1950,1960,1940,nan,1200000",
                "2023-04-03,1960,1990,1950,1980,800000",
                ""));

        loader.loadData(List.of("7203"), START, END);

        List<PriceBar> bars = loader.priceBars("7203");
        assertThat(bars).extracting(PriceBar::getDate).containsExactly(
                LocalDate.of(2023, 3, 24), LocalDate.of(2023, 3, 27), LocalDate.of(2023, 3, 28), LocalDate.of(2023, 3, 29));
        assertThat(bars.get(2).hasClose()).isFalse();
        assertThat(bars.get(3).hasClose()).isFalse();
        assertThat(bars.get(1).getVolume()).isEqualTo(1100000L);
        assertThat(loader.priceOnDate("7203", LocalDate.of(2023, 3, 29))).contains(new BigDecimal("2010"));
    }

    @Test
    @DisplayName("Derives a blank record date from the ex-dividend date")
    void loadsDividends() throws IOException {
        Files.writeString(dataDir.resolve("7203_prices.csv"), "date,open,high,low,close,volume\n2023-03-27,1,1,1,1,1\n");
        Files.writeString(dataDir.resolve("7203_dividends.csv"), String.join("\n",
                "ex_dividend_date,record_date,dividend_amount",
                "2023-09-27,2023-09-29,30",
                "2023-03-29,,50",
                ""));

        loader.loadData(List.of("7203"), START, END);

        List<DividendInfo> dividends = loader.dividends("7203");
        assertThat(dividends).hasSize(2);
        assertThat(dividends.get(0).getRecordDate()).isEqualTo(LocalDate.of(2023, 3, 31));
        assertThat(dividends.get(0).getDividendPerShare()).isEqualByComparingTo("50");
        assertThat(loader.nextDividend("7203", LocalDate.of(2023, 3, 31)))
                .get().extracting(DividendInfo::getExDividendDate).isEqualTo(LocalDate.of(2023, 9, 27));
    }

    @Test
    @DisplayName("Missing files leave the instrument empty")
    void missingFiles() {
        loader.loadData(List.of("9999"), START, END);

        assertThat(loader.priceBars("9999")).isEmpty();
        assertThat(loader.dividends("9999")).isEmpty();
        assertThat(loader.priceOnDate("9999", END)).isEmpty();
    }

    @Test
    @DisplayName("Unparseable values raise a market data error")
    void malformed() throws IOException {
        Files.writeString(dataDir.resolve("7203_prices.csv"), "date,open,high,low,close,volume\n2023-03-27,1,1,1,abc,1\n");

        assertThatThrownBy(() -> loader.loadData(List.of("7203"), START, END))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("abc");
    }
}
