package com.dividendcapture.engine;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.domain.enums.RejectionReason;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.ExecutionResult;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.Signal;
import com.dividendcapture.domain.model.SignalRecord;
import com.dividendcapture.ledger.TradeLogRow;
import com.dividendcapture.marketdata.DataValidationReport;
import com.dividendcapture.marketdata.MarketDataProvider;
import com.dividendcapture.marketdata.MarketDataValidator;
import com.dividendcapture.observability.BacktestJournal;
import com.dividendcapture.pnl.DividendPaymentScheduler;
import com.dividendcapture.pnl.ExecutionCostModel;
import com.dividendcapture.portfolio.PerformanceMetrics;
import com.dividendcapture.portfolio.Portfolio;
import com.dividendcapture.strategy.DividendCaptureStrategy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Day-by-day orchestration of one backtest run.
 *
 * <p>An engine instance runs exactly once. It owns the run's {@link Portfolio}, the
 * strategy, cost model and payment scheduler built from the config, and the journal passed
 * in by the caller. For every business day in the window, in fixed order:
 * <ol>
 *   <li>Look up closes for the universe; instruments without a price are skipped for the day</li>
 *   <li>For each open position, in opening order: check exits; if none fired and today is the
 *       position's ex-dividend date, record the pre-ex close and check for an addition</li>
 *   <li>For each instrument without an open position, in universe order: check for an entry
 *       into its next dividend and validate it against cash and the position cap</li>
 *   <li>Credit dividends whose payment date is today, including those of positions sold
 *       after their ex-dividend date</li>
 *   <li>Mark the portfolio to market</li>
 * </ol>
 *
 * <p>Market data is loaded and validated once before the first day; an instrument with no
 * usable prices aborts the run with a {@link com.dividendcapture.exception.DataValidationException}.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    static final int PROGRESS_INTERVAL_DAYS = 20;

    private final BacktestConfig config;
    private final MarketDataProvider marketData;
    private final BusinessDayCalendar calendar;
    private final MarketDataValidator validator;
    private final BacktestJournal journal;

    private final DividendCaptureStrategy strategy;
    private final ExecutionCostModel costModel;
    private final DividendPaymentScheduler paymentScheduler;
    private final Portfolio portfolio;
    private final List<SignalRecord> signalHistory = new ArrayList<>();

    private boolean started;

    public BacktestEngine(
            BacktestConfig config,
            MarketDataProvider marketData,
            BusinessDayCalendar calendar,
            DividendDateCalculator dividendDateCalculator,
            MarketDataValidator validator,
            BacktestJournal journal) {
        this.config = config.validate();
        this.marketData = marketData;
        this.calendar = calendar;
        this.validator = validator;
        this.journal = journal;
        this.strategy = new DividendCaptureStrategy(config.getStrategy(), calendar, dividendDateCalculator);
        this.costModel = new ExecutionCostModel(config.getExecution());
        this.paymentScheduler = new DividendPaymentScheduler(config.getDividend(), calendar);
        this.portfolio = new Portfolio(config.getInitialCapital(), journal);
    }

    /**
     * Loads data, simulates every business day of the window and collects the results.
     *
     * @throws com.dividendcapture.exception.DataValidationException if any instrument has no usable prices
     */
    public BacktestResult run() {
        if (started) {
            throw new IllegalStateException("A backtest engine runs only once; create a new engine per run");
        }
        started = true;

        List<String> tickers = config.getTickers();
        log.info("Backtest period: {} to {}, initial capital {}, {} tickers",
                config.getStartDate(), config.getEndDate(), config.getInitialCapital(), tickers.size());

        marketData.loadData(tickers, config.getStartDate(), config.getEndDate());
        DataValidationReport validation = validator.validateOrThrow(marketData, tickers);
        journal.logDataValidation(config.getStartDate(), validation);

        List<LocalDate> tradingDays = calendar.businessDaysInRange(config.getStartDate(), config.getEndDate());
        journal.logRunStarted(config.getStartDate(), config.getEndDate(), config.getInitialCapital(), tickers.size());

        for (int i = 0; i < tradingDays.size(); i++) {
            LocalDate day = tradingDays.get(i);
            if (i % PROGRESS_INTERVAL_DAYS == 0) {
                journal.logProgress(day, i, tradingDays.size());
            }
            processDay(day);
        }

        LocalDate lastDay = tradingDays.isEmpty() ? config.getEndDate() : tradingDays.get(tradingDays.size() - 1);
        PerformanceMetrics metrics = portfolio.performanceMetrics();
        List<TradeLogRow> trades = portfolio.getPositionRegistry().tradeLog();
        journal.logRunCompleted(lastDay, metrics.getFinalValue(), trades.size());

        return BacktestResult.builder()
                .config(config)
                .metrics(metrics)
                .trades(trades)
                .positions(portfolio.getPositionRegistry().positionsSummary(lastDay))
                .dailySnapshots(List.copyOf(portfolio.getDailyHistory()))
                .signals(List.copyOf(signalHistory))
                .journal(List.copyOf(journal.getEntries()))
                .holdings(portfolio.currentHoldings())
                .dataValidation(validation)
                .finalCash(portfolio.getCash())
                .tradingDays(tradingDays.size())
                .build();
    }

    public Portfolio getPortfolio() {
        return portfolio;
    }

    // ---- Daily processing ----

    void processDay(LocalDate date) {
        Map<String, BigDecimal> prices = currentPrices(date);
        processExistingPositions(date, prices);
        checkNewEntries(date, prices);
        processDividends(date);
        portfolio.markToMarket(date, prices);
    }

    private Map<String, BigDecimal> currentPrices(LocalDate date) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (String ticker : config.getTickers()) {
            Optional<BigDecimal> price = marketData.priceOnDate(ticker, date);
            if (price.isPresent()) {
                prices.put(ticker, price.get());
            } else {
                journal.logPriceMissing(date, ticker);
            }
        }
        return prices;
    }

    private void processExistingPositions(LocalDate date, Map<String, BigDecimal> prices) {
        for (Position position : portfolio.getPositionRegistry().getOpenPositions()) {
            String instrument = position.getInstrument();
            BigDecimal price = prices.get(instrument);
            if (price == null) {
                continue;
            }

            Signal exit = strategy.checkExitSignal(instrument, date, position.toContext(), price);
            if (exit != null) {
                executeExit(exit, position);
                continue;
            }

            if (date.equals(position.getExDividendDate())) {
                handleExDividendDate(date, position, price);
            }
        }
    }

    private void handleExDividendDate(LocalDate date, Position position, BigDecimal price) {
        String instrument = position.getInstrument();
        LocalDate preExDate = calendar.previousBusinessDay(date);
        Optional<BigDecimal> preExPrice = marketData.priceOnDate(instrument, preExDate);
        if (preExPrice.isEmpty()) {
            log.debug("No pre-ex close for {} on {}", instrument, preExDate);
            return;
        }

        portfolio.getPositionRegistry().updatePreExPrice(instrument, preExPrice.get());
        journal.logPreExPrice(date, instrument, preExPrice.get());

        if (!config.getStrategy().isAdditionEnabled()) {
            return;
        }
        Signal addition = strategy.checkAdditionSignal(
                instrument, date, position.toContext(), price, preExPrice.get());
        if (addition != null) {
            executeBuy(addition, null, true);
        }
    }

    private void checkNewEntries(LocalDate date, Map<String, BigDecimal> prices) {
        if (portfolio.getPositionRegistry().getOpenPositionCount() >= config.getStrategy().getMaxPositions()) {
            return;
        }

        for (String ticker : config.getTickers()) {
            if (portfolio.getPositionRegistry().hasOpenPosition(ticker)) {
                continue;
            }
            BigDecimal price = prices.get(ticker);
            if (price == null) {
                continue;
            }
            Optional<DividendInfo> dividend = marketData.nextDividend(ticker, date);
            if (dividend.isEmpty()) {
                continue;
            }

            Signal entry = strategy.checkEntrySignal(ticker, date, dividend.get(), price);
            if (entry == null) {
                continue;
            }
            if (!strategy.validateSignal(entry, portfolio.toContext())) {
                journal.logSignal(entry, false, RejectionReason.SIGNAL_REJECTED);
                signalHistory.add(signalRecord(entry, entry.getPrice(), false, RejectionReason.SIGNAL_REJECTED));
                continue;
            }
            executeBuy(entry, dividend.get(), date.equals(dividend.get().getExDividendDate()));
        }
    }

    private void processDividends(LocalDate date) {
        for (Position position : portfolio.getPositionRegistry().getPendingDividendPositions()) {
            if (paymentScheduler.isPaymentDue(position, date)) {
                BigDecimal netPerShare = costModel.netDividendPerShare(position.getDividendPerShare());
                portfolio.creditDividend(position, netPerShare, date);
            }
        }
    }

    // ---- Execution ----

    private void executeBuy(Signal signal, DividendInfo dividendInfo, boolean exDividendDate) {
        journal.logSignal(signal, true, null);

        BigDecimal fillPrice = costModel.buyFillPrice(signal.getPrice(), exDividendDate);
        BigDecimal commission = costModel.commission(fillPrice, signal.getShares());
        ExecutionResult result = portfolio.executeBuy(
                signal.getInstrument(),
                signal.getKind(),
                signal.getDate(),
                fillPrice,
                signal.getShares(),
                commission,
                signal.getReason(),
                dividendInfo);

        signalHistory.add(signalRecord(signal, fillPrice, result.isSuccess(), result.getRejectionReason()));
    }

    private void executeExit(Signal signal, Position position) {
        journal.logSignal(signal, true, null);

        boolean exDividendDate = signal.getDate().equals(position.getExDividendDate());
        BigDecimal fillPrice = costModel.sellFillPrice(signal.getPrice(), exDividendDate);
        BigDecimal commission = costModel.commission(fillPrice, signal.getShares());
        ExecutionResult result = portfolio.executeSell(
                signal.getInstrument(),
                signal.getDate(),
                fillPrice,
                commission,
                signal.getReason(),
                signal.getExitReason());

        signalHistory.add(signalRecord(signal, fillPrice, result.isSuccess(), result.getRejectionReason()));
    }

    private static SignalRecord signalRecord(
            Signal signal, BigDecimal price, boolean executed, RejectionReason rejectionReason) {
        return SignalRecord.builder()
                .date(signal.getDate())
                .instrument(signal.getInstrument())
                .kind(signal.getKind())
                .price(price)
                .shares(signal.getShares())
                .executed(executed)
                .rejectionReason(rejectionReason)
                .reason(signal.getReason())
                .build();
    }
}
