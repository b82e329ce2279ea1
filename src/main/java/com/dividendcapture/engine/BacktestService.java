package com.dividendcapture.engine;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.marketdata.MarketDataProvider;
import com.dividendcapture.marketdata.MarketDataValidator;
import com.dividendcapture.observability.BacktestJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for running backtests. Builds a fresh {@link BacktestEngine} and
 * {@link BacktestJournal} for every run so no state leaks between runs.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final BusinessDayCalendar businessDayCalendar;
    private final DividendDateCalculator dividendDateCalculator;
    private final MarketDataValidator marketDataValidator;

    public BacktestService(
            BusinessDayCalendar businessDayCalendar,
            DividendDateCalculator dividendDateCalculator,
            MarketDataValidator marketDataValidator) {
        this.businessDayCalendar = businessDayCalendar;
        this.dividendDateCalculator = dividendDateCalculator;
        this.marketDataValidator = marketDataValidator;
    }

    public BacktestResult run(BacktestConfig config, MarketDataProvider marketData) {
        BacktestEngine engine = new BacktestEngine(
                config,
                marketData,
                businessDayCalendar,
                dividendDateCalculator,
                marketDataValidator,
                new BacktestJournal());
        BacktestResult result = engine.run();
        log.info("Backtest finished: {} trading days, {} trades, final value {}",
                result.getTradingDays(), result.getTrades().size(), result.getMetrics().getFinalValue());
        return result;
    }
}
