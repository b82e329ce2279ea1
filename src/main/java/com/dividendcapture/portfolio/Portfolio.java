package com.dividendcapture.portfolio;

import com.dividendcapture.domain.enums.ExitReason;
import com.dividendcapture.domain.enums.RejectionReason;
import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.model.DailySnapshot;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.ExecutionResult;
import com.dividendcapture.domain.model.PortfolioContext;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.Trade;
import com.dividendcapture.ledger.HoldingView;
import com.dividendcapture.ledger.PositionRegistry;
import com.dividendcapture.observability.BacktestJournal;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cash and positions of one backtest run.
 *
 * <p>Owns the cash balance and the daily valuation history, and delegates position
 * bookkeeping to a {@link PositionRegistry}. Buy, sell and dividend operations return an
 * {@link ExecutionResult}; a rejected operation leaves cash and positions untouched.
 *
 * <p>Cash moves by exactly the trade's gross amount: {@code price x shares + commission}
 * out on a buy, {@code price x shares - commission} in on a sell, and the credited dividend
 * in on a payment.
 *
 * <p>Buys are routed by {@link SignalKind}: ENTRY opens a position and is rejected as a
 * duplicate if one is already open; ADD increases an open position and is rejected if there
 * is none.
 */
public class Portfolio {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    private final BigDecimal initialCapital;
    private final PositionRegistry positionRegistry = new PositionRegistry();
    private final BacktestJournal journal;
    private final PerformanceCalculator performanceCalculator = new PerformanceCalculator();
    private final List<DailySnapshot> dailyHistory = new ArrayList<>();

    private BigDecimal cash;
    private BigDecimal totalCommission = BigDecimal.ZERO;
    private BigDecimal totalDividend = BigDecimal.ZERO;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    public Portfolio(BigDecimal initialCapital, BacktestJournal journal) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive: " + initialCapital);
        }
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
        this.journal = journal;
        log.info("Portfolio initialized with capital: {}", initialCapital);
    }

    public Portfolio(BigDecimal initialCapital) {
        this(initialCapital, new BacktestJournal());
    }

    /**
     * Executes an ENTRY or ADD buy.
     *
     * @param dividendInfo dividend captured by a new position; ignored for additions
     */
    public ExecutionResult executeBuy(
            String instrument,
            SignalKind kind,
            LocalDate date,
            BigDecimal price,
            int shares,
            BigDecimal commission,
            String reason,
            DividendInfo dividendInfo) {

        ExecutionResult result = buy(instrument, kind, date, price, shares, commission, reason, dividendInfo);
        journal.logExecution(date, instrument, kind, result);
        return result;
    }

    /**
     * Sells the entire open position in {@code instrument}.
     */
    public ExecutionResult executeSell(
            String instrument, LocalDate date, BigDecimal price, BigDecimal commission, String reason) {
        return executeSell(instrument, date, price, commission, reason, null);
    }

    /**
     * Sells the entire open position, recording {@code exitReason} on the closed position.
     */
    public ExecutionResult executeSell(
            String instrument,
            LocalDate date,
            BigDecimal price,
            BigDecimal commission,
            String reason,
            ExitReason exitReason) {

        ExecutionResult result = sell(instrument, date, price, commission, reason, exitReason);
        journal.logExecution(date, instrument, SignalKind.EXIT, result);
        return result;
    }

    /**
     * Credits the open position's dividend once, to the shares held before its ex-dividend date.
     *
     * @param dividendPerShare amount per share actually paid, after any withholding
     */
    public ExecutionResult creditDividend(String instrument, BigDecimal dividendPerShare, LocalDate date) {
        Optional<Position> open = positionRegistry.getOpenPosition(instrument);
        if (open.isEmpty()) {
            ExecutionResult result = ExecutionResult.rejected(
                    RejectionReason.NO_POSITION, "No open position for " + instrument);
            journal.logDividend(date, instrument, result);
            return result;
        }
        return creditDividend(open.get(), dividendPerShare, date);
    }

    /**
     * Credits a position's dividend on its payment date. The position may already be closed
     * when it was sold after the ex-dividend date; the credit then also lands in its realized
     * P&L and the win/loss counters follow the new sign.
     */
    public ExecutionResult creditDividend(Position position, BigDecimal dividendPerShare, LocalDate date) {
        String instrument = position.getInstrument();
        ExecutionResult result;
        if (position.isDividendCredited()) {
            result = ExecutionResult.rejected(
                    RejectionReason.DIVIDEND_ALREADY_CREDITED, "Dividend already credited for " + instrument);
        } else if (position.dividendEntitledShares() <= 0) {
            result = ExecutionResult.rejected(
                    RejectionReason.NOT_ENTITLED, "No shares of " + instrument + " held before the ex-dividend date");
        } else {
            boolean wasWinning = position.getRealizedPnL().signum() > 0;
            BigDecimal amount = positionRegistry.creditDividend(position, dividendPerShare);
            cash = cash.add(amount);
            totalDividend = totalDividend.add(amount);
            if (!position.isOpen() && !wasWinning && position.getRealizedPnL().signum() > 0) {
                winningTrades++;
                losingTrades--;
            }
            log.info("Dividend received: {} {} on {}", instrument, amount, date);
            result = ExecutionResult.credited(position, amount);
        }
        journal.logDividend(date, instrument, result);
        return result;
    }

    /**
     * Values open positions at {@code prices} and appends the day's snapshot. An instrument
     * missing from {@code prices} is valued at its average cost.
     */
    public DailySnapshot markToMarket(LocalDate date, Map<String, BigDecimal> prices) {
        BigDecimal positionsValue = positionRegistry.totalMarketValue(prices);
        BigDecimal totalValue = cash.add(positionsValue);

        double dailyReturn = 0;
        if (!dailyHistory.isEmpty()) {
            BigDecimal previous = dailyHistory.get(dailyHistory.size() - 1).getTotalValue();
            if (previous.signum() > 0) {
                dailyReturn = totalValue.subtract(previous).divide(previous, MathContext.DECIMAL64).doubleValue();
            }
        }
        double cumulativeReturn = totalValue.subtract(initialCapital)
                .divide(initialCapital, MathContext.DECIMAL64)
                .doubleValue();

        DailySnapshot snapshot = DailySnapshot.builder()
                .date(date)
                .cash(cash)
                .positionsMarketValue(positionsValue)
                .totalValue(totalValue)
                .dailyReturn(dailyReturn)
                .cumulativeReturn(cumulativeReturn)
                .openPositionCount(positionRegistry.getOpenPositionCount())
                .build();
        dailyHistory.add(snapshot);
        return snapshot;
    }

    public PerformanceMetrics performanceMetrics() {
        return performanceCalculator.calculate(
                initialCapital,
                dailyHistory,
                positionRegistry.getAllTrades(),
                positionRegistry.getClosedPositions(),
                positionRegistry.getAllPositions());
    }

    public PortfolioContext toContext() {
        return new PortfolioContext(cash, positionRegistry.getOpenPositionCount());
    }

    public List<HoldingView> currentHoldings() {
        return positionRegistry.currentHoldings();
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public PositionRegistry getPositionRegistry() {
        return positionRegistry;
    }

    public BacktestJournal getJournal() {
        return journal;
    }

    public List<DailySnapshot> getDailyHistory() {
        return Collections.unmodifiableList(dailyHistory);
    }

    public BigDecimal getTotalCommission() {
        return totalCommission;
    }

    public BigDecimal getTotalDividend() {
        return totalDividend;
    }

    public int getTotalTrades() {
        return totalTrades;
    }

    public int getWinningTrades() {
        return winningTrades;
    }

    public int getLosingTrades() {
        return losingTrades;
    }

    // ---- Internal execution logic ----

    private ExecutionResult buy(
            String instrument,
            SignalKind kind,
            LocalDate date,
            BigDecimal price,
            int shares,
            BigDecimal commission,
            String reason,
            DividendInfo dividendInfo) {

        if (kind == null || !kind.isBuy()) {
            return ExecutionResult.rejected(RejectionReason.INVALID_ORDER, "Buy requires ENTRY or ADD, got " + kind);
        }
        if (price == null || price.signum() <= 0 || shares <= 0 || commission == null || commission.signum() < 0) {
            return ExecutionResult.rejected(RejectionReason.INVALID_ORDER,
                    "Invalid buy for " + instrument + ": " + shares + "@" + price + " commission " + commission);
        }

        BigDecimal required = price.multiply(BigDecimal.valueOf(shares)).add(commission);
        if (required.compareTo(cash) > 0) {
            log.warn("Insufficient cash for {}: required={}, available={}", instrument, required, cash);
            return ExecutionResult.rejected(RejectionReason.INSUFFICIENT_CASH,
                    "Insufficient cash for " + instrument + ": required " + required + ", available " + cash);
        }

        boolean hasPosition = positionRegistry.hasOpenPosition(instrument);
        if (kind == SignalKind.ENTRY && hasPosition) {
            log.warn("Position already exists for {}, skipping duplicate buy. Reason: {}", instrument, reason);
            return ExecutionResult.rejected(RejectionReason.DUPLICATE_ENTRY,
                    "Position already open for " + instrument);
        }
        if (kind == SignalKind.ADD && !hasPosition) {
            return ExecutionResult.rejected(RejectionReason.NO_POSITION,
                    "No open position to add to for " + instrument);
        }

        Trade trade = Trade.buy(instrument, kind, date, price, shares, commission, reason);
        Position position = kind == SignalKind.ENTRY
                ? positionRegistry.openPosition(trade, dividendInfo)
                : positionRegistry.addToPosition(trade);

        cash = cash.subtract(trade.getGrossAmount());
        totalCommission = totalCommission.add(commission);
        totalTrades++;
        log.info("Buy executed: {} {} {}@{}, cash remaining: {}", kind, instrument, shares, price, cash);
        return ExecutionResult.filled(trade, position);
    }

    private ExecutionResult sell(
            String instrument,
            LocalDate date,
            BigDecimal price,
            BigDecimal commission,
            String reason,
            ExitReason exitReason) {

        Optional<Position> open = positionRegistry.getOpenPosition(instrument);
        if (open.isEmpty()) {
            log.warn("No position to sell for {}", instrument);
            return ExecutionResult.rejected(RejectionReason.NO_POSITION, "No open position for " + instrument);
        }
        if (price == null || price.signum() <= 0 || commission == null || commission.signum() < 0) {
            return ExecutionResult.rejected(RejectionReason.INVALID_ORDER,
                    "Invalid sell for " + instrument + ": price " + price + " commission " + commission);
        }

        int shares = open.get().getShares();
        Trade trade = Trade.sell(instrument, date, price, shares, commission, reason);
        Position closed = positionRegistry.closePosition(trade, exitReason != null ? exitReason.getKey() : reason);

        cash = cash.add(trade.getGrossAmount());
        totalCommission = totalCommission.add(commission);
        totalTrades++;
        if (closed.getRealizedPnL().signum() > 0) {
            winningTrades++;
        } else {
            losingTrades++;
        }
        log.info("Sell executed: {} {}@{}, PnL: {}", instrument, shares, price, closed.getRealizedPnL());
        return ExecutionResult.filled(trade, closed);
    }
}
