package com.dividendcapture.ledger;

import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Book of all positions of one backtest run.
 *
 * <p>Open positions are keyed by instrument in insertion order, so iteration over them is
 * stable across runs given identical inputs. A position moves to the closed list exactly
 * when its closing sell is applied. Every trade applied to any position is mirrored into a
 * global trade log in execution order.
 *
 * <p>The registry enforces the lifecycle (one open position per instrument, no additions or
 * closes without an open position) and throws {@link IllegalStateException} on violations.
 * Expected rejections such as insufficient cash are decided by the portfolio before it
 * calls in here.
 */
public class PositionRegistry {

    private static final Logger log = LoggerFactory.getLogger(PositionRegistry.class);

    private final Map<String, Position> openPositions = new LinkedHashMap<>();
    private final List<Position> closedPositions = new ArrayList<>();
    private final List<Trade> allTrades = new ArrayList<>();

    /**
     * Opens a position from its first BUY. The trade is applied once, by {@link Position#open}.
     */
    public Position openPosition(Trade openingTrade, DividendInfo dividendInfo) {
        String instrument = openingTrade.getInstrument();
        if (openPositions.containsKey(instrument)) {
            throw new IllegalStateException("Position already open for " + instrument);
        }
        Position position = Position.open(openingTrade, dividendInfo);
        openPositions.put(instrument, position);
        allTrades.add(openingTrade);
        log.debug("Position opened: {} shares={} price={}", instrument, position.getShares(), openingTrade.getPrice());
        return position;
    }

    /** Applies an addition BUY to the open position in the trade's instrument. */
    public Position addToPosition(Trade buyTrade) {
        Position position = requireOpen(buyTrade.getInstrument());
        position.addTrade(buyTrade);
        allTrades.add(buyTrade);
        log.debug("Position added: {} shares={} avgCost={}",
                position.getInstrument(), position.getShares(), position.getAverageCost());
        return position;
    }

    /** Closes the open position with a full SELL and moves it to the closed list. */
    public Position closePosition(Trade sellTrade, String reason) {
        Position position = requireOpen(sellTrade.getInstrument());
        position.close(sellTrade, reason);
        allTrades.add(sellTrade);
        openPositions.remove(position.getInstrument());
        closedPositions.add(position);
        log.debug("Position closed: {} realizedPnL={} reason={}",
                position.getInstrument(), position.getRealizedPnL(), reason);
        return position;
    }

    /**
     * Credits the position's dividend to the shares held before its ex-dividend date.
     *
     * @param netPerShare dividend per share after withholding
     * @return amount credited
     */
    public BigDecimal creditDividend(String instrument, BigDecimal netPerShare) {
        return creditDividend(requireOpen(instrument), netPerShare);
    }

    /**
     * Credits a position's dividend, open or already closed, to its entitled shares.
     *
     * @return amount credited
     */
    public BigDecimal creditDividend(Position position, BigDecimal netPerShare) {
        BigDecimal amount = position.creditDividend(netPerShare, position.dividendEntitledShares());
        log.debug("Dividend credited: {} amount={} open={}", position.getInstrument(), amount, position.isOpen());
        return amount;
    }

    public void updatePreExPrice(String instrument, BigDecimal price) {
        requireOpen(instrument).recordPreExPrice(price);
    }

    // ---- Queries ----

    public Optional<Position> getOpenPosition(String instrument) {
        return Optional.ofNullable(openPositions.get(instrument));
    }

    public boolean hasOpenPosition(String instrument) {
        return openPositions.containsKey(instrument);
    }

    /** Snapshot of open positions in insertion order; safe to iterate while closing. */
    public List<Position> getOpenPositions() {
        return List.copyOf(openPositions.values());
    }

    public List<Position> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    /** Closed positions first, in closing order, then open ones in insertion order. */
    public List<Position> getAllPositions() {
        List<Position> all = new ArrayList<>(closedPositions);
        all.addAll(openPositions.values());
        return all;
    }

    /**
     * Positions, open or closed, holding an entitled dividend that has not been paid yet;
     * closed positions first, in closing order.
     */
    public List<Position> getPendingDividendPositions() {
        return getAllPositions().stream().filter(Position::hasPendingDividend).toList();
    }

    public List<Trade> getAllTrades() {
        return Collections.unmodifiableList(allTrades);
    }

    public int getOpenPositionCount() {
        return openPositions.size();
    }

    /**
     * Sum of price x shares over open positions. An instrument missing from {@code prices}
     * is valued at its average cost.
     */
    public BigDecimal totalMarketValue(Map<String, BigDecimal> prices) {
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : openPositions.values()) {
            BigDecimal price = prices.get(position.getInstrument());
            total = total.add(position.marketValue(price != null ? price : position.getAverageCost()));
        }
        return total;
    }

    public BigDecimal totalRealizedPnl() {
        return closedPositions.stream().map(Position::getRealizedPnL).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCommission() {
        return allTrades.stream().map(Trade::getCommission).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalDividendsReceived() {
        return getAllPositions().stream()
                .map(Position::getDividendReceivedTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<TradeLogRow> tradeLog() {
        return allTrades.stream().map(TradeLogRow::of).toList();
    }

    public List<PositionSummaryRow> positionsSummary(LocalDate asOf) {
        return getAllPositions().stream().map(p -> PositionSummaryRow.of(p, asOf)).toList();
    }

    public List<HoldingView> currentHoldings() {
        return openPositions.values().stream()
                .map(p -> HoldingView.builder()
                        .instrument(p.getInstrument())
                        .shares(p.getShares())
                        .averageCost(p.getAverageCost())
                        .costBasis(p.getCostBasis())
                        .entryDate(p.getEntryDate())
                        .exDividendDate(p.getExDividendDate())
                        .build())
                .toList();
    }

    private Position requireOpen(String instrument) {
        Position position = openPositions.get(instrument);
        if (position == null) {
            throw new IllegalStateException("No open position for " + instrument);
        }
        return position;
    }
}
