package com.dividendcapture.unit;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PriceBar;
import com.dividendcapture.engine.BacktestEngine;
import com.dividendcapture.engine.BacktestResult;
import com.dividendcapture.marketdata.InMemoryMarketDataProvider;
import com.dividendcapture.marketdata.MarketDataValidator;
import com.dividendcapture.observability.BacktestJournal;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** A small completed run used by the reporting tests. */
public final class TestResults {

    private TestResults() {}

    /** One dividend-capture round trip on 7203 between 2023-03-24 and 2023-04-07, no costs. */
    public static BacktestResult roundTrip() {
        BusinessDayCalendar calendar = TestCalendars.tse2023();
        String[] closes = {"2000", "2000", "2000", "2000", "1950", "1980", "2000"};
        List<PriceBar> bars = new ArrayList<>();
        LocalDate date = LocalDate.of(2023, 3, 23);
        for (String close : closes) {
            BigDecimal price = new BigDecimal(close);
            bars.add(PriceBar.builder().date(date).open(price).high(price).low(price).close(price).volume(1000).build());
            date = calendar.nextBusinessDay(date);
        }
        InMemoryMarketDataProvider data = new InMemoryMarketDataProvider()
                .putPriceBars("7203", bars)
                .putDividends("7203", List.of(DividendInfo.builder()
                        .exDividendDate(LocalDate.of(2023, 3, 29))
                        .recordDate(LocalDate.of(2023, 3, 31))
                        .dividendPerShare(new BigDecimal("50"))
                        .build()));

        BacktestEngine engine = new BacktestEngine(
                TestConfigs.backtest(LocalDate.of(2023, 3, 24), LocalDate.of(2023, 4, 7), "7203")
                        .execution(TestConfigs.frictionless())
                        .build(),
                data,
                calendar,
                new DividendDateCalculator(calendar),
                new MarketDataValidator(),
                new BacktestJournal());
        return engine.run();
    }
}
