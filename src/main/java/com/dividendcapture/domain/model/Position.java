package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.PositionStatus;
import com.dividendcapture.domain.enums.TradeType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * A holding in one instrument, from its opening buy to its closing sell.
 *
 * <p>State is only changed through {@link #open}, {@link #addTrade}, {@link #close} and
 * {@link #creditDividend}; each trade is applied exactly once. The dividend may be credited
 * after the close when the payment date falls later. {@code open} seeds the share
 * count, cost and trade list directly from the opening trade and never calls
 * {@code addTrade} for that same trade.
 *
 * <p>Cost accounting:
 * <ul>
 *   <li>{@code averageCost} is the share-weighted fill price, excluding commission. It is
 *       recomputed on BUY trades only: {@code (averageCost x sharesBefore + price x shares) / sharesAfter}</li>
 *   <li>Commissions accumulate in {@code totalCommission}; buy-side commission is charged
 *       once against realized P&L on close</li>
 *   <li>A SELL never changes {@code averageCost}. The only sell is the full close, which sets
 *       {@code realizedPnL = (sellPrice x shares - sellCommission) - (averageCost x shares + buyCommission) + dividends}</li>
 * </ul>
 */
@Getter
public class Position {

    static final int AVERAGE_COST_SCALE = 6;

    private final String instrument;
    private PositionStatus status;
    private final LocalDate entryDate;
    private final BigDecimal entryPrice;

    /** Shares bought by the opening trade; additions are sized relative to this. */
    private final int initialShares;

    private int shares;
    private BigDecimal averageCost;

    /** Price x shares over the open holding, without commission. Equals averageCost x shares. */
    private BigDecimal costBasis;

    private final List<Trade> trades = new ArrayList<>();

    private final LocalDate exDividendDate;
    private final LocalDate recordDate;
    private final BigDecimal dividendPerShare;
    private BigDecimal preExPrice;
    private BigDecimal dividendReceivedTotal = BigDecimal.ZERO;
    private boolean dividendCredited;

    private LocalDate exitDate;
    private BigDecimal exitPrice;
    private String exitReason;

    private BigDecimal realizedPnL = BigDecimal.ZERO;
    private BigDecimal totalCommission;
    private BigDecimal buyCommission;

    private Position(Trade openingTrade, DividendInfo dividendInfo) {
        this.instrument = openingTrade.getInstrument();
        this.status = PositionStatus.OPEN;
        this.entryDate = openingTrade.getDate();
        this.entryPrice = openingTrade.getPrice();
        this.initialShares = openingTrade.getShares();
        this.shares = openingTrade.getShares();
        this.averageCost = openingTrade.getPrice();
        this.costBasis = openingTrade.getNotional();
        this.totalCommission = openingTrade.getCommission();
        this.buyCommission = openingTrade.getCommission();
        this.trades.add(openingTrade);
        this.exDividendDate = dividendInfo != null ? dividendInfo.getExDividendDate() : null;
        this.recordDate = dividendInfo != null ? dividendInfo.getRecordDate() : null;
        this.dividendPerShare = dividendInfo != null ? dividendInfo.getDividendPerShare() : null;
    }

    /**
     * Creates an OPEN position seeded from its opening BUY trade.
     *
     * @param openingTrade the BUY that opens the position
     * @param dividendInfo the dividend being captured, or null when none is known
     */
    public static Position open(Trade openingTrade, DividendInfo dividendInfo) {
        if (openingTrade.getType() != TradeType.BUY) {
            throw new IllegalArgumentException("A position can only be opened by a BUY trade");
        }
        return new Position(openingTrade, dividendInfo);
    }

    /**
     * Applies an additional BUY to this open position and recomputes the average cost.
     */
    public void addTrade(Trade buyTrade) {
        requireOpen();
        requireSameInstrument(buyTrade);
        if (buyTrade.getType() != TradeType.BUY) {
            throw new IllegalArgumentException("Only BUY trades can be added; use close() for sells");
        }

        int sharesAfter = shares + buyTrade.getShares();
        BigDecimal existingCost = averageCost.multiply(BigDecimal.valueOf(shares));
        averageCost = existingCost
                .add(buyTrade.getNotional())
                .divide(BigDecimal.valueOf(sharesAfter), AVERAGE_COST_SCALE, RoundingMode.HALF_UP);
        costBasis = costBasis.add(buyTrade.getNotional());
        shares = sharesAfter;
        totalCommission = totalCommission.add(buyTrade.getCommission());
        buyCommission = buyCommission.add(buyTrade.getCommission());
        trades.add(buyTrade);
    }

    /**
     * Closes the position with a SELL of the entire holding. Partial exits are not modeled.
     *
     * @param sellTrade the SELL; its share count must equal the current holding
     * @param reason    exit reason recorded on the position
     */
    public void close(Trade sellTrade, String reason) {
        requireOpen();
        requireSameInstrument(sellTrade);
        if (sellTrade.getType() != TradeType.SELL) {
            throw new IllegalArgumentException("A position can only be closed by a SELL trade");
        }
        if (sellTrade.getShares() != shares) {
            throw new IllegalStateException("Close must sell the full holding of " + shares + " shares for "
                    + instrument + ", got " + sellTrade.getShares());
        }

        BigDecimal proceeds = sellTrade.getGrossAmount();
        BigDecimal cost = costBasis.add(buyCommission);
        realizedPnL = proceeds.subtract(cost).add(dividendReceivedTotal);

        totalCommission = totalCommission.add(sellTrade.getCommission());
        shares = 0;
        costBasis = BigDecimal.ZERO;
        status = PositionStatus.CLOSED;
        exitDate = sellTrade.getDate();
        exitPrice = sellTrade.getPrice();
        exitReason = reason;
        trades.add(sellTrade);
    }

    /**
     * Credits this position's dividend once. A position closed after its ex-dividend date
     * still receives the dividend on the payment date; the amount is then also added to the
     * already realized P&L.
     *
     * @param perShare       amount per eligible share (net of any withholding)
     * @param eligibleShares shares entitled to the dividend
     * @return the amount credited
     */
    public BigDecimal creditDividend(BigDecimal perShare, int eligibleShares) {
        if (dividendCredited) {
            throw new IllegalStateException("Dividend already credited for " + instrument);
        }
        if (eligibleShares <= 0) {
            throw new IllegalStateException("No shares of " + instrument + " entitled to the dividend");
        }
        BigDecimal amount = perShare.multiply(BigDecimal.valueOf(eligibleShares));
        dividendReceivedTotal = dividendReceivedTotal.add(amount);
        dividendCredited = true;
        if (!isOpen()) {
            realizedPnL = realizedPnL.add(amount);
        }
        return amount;
    }

    /**
     * Shares entitled to this position's dividend: those held before the ex-dividend date.
     * Fixed once the ex-date has passed, whether or not the position is still open.
     */
    public int dividendEntitledShares() {
        if (!hasDividendInfo()) {
            return isOpen() ? shares : 0;
        }
        return sharesHeldBefore(exDividendDate);
    }

    /** True while an entitled dividend is still waiting to be paid. */
    public boolean hasPendingDividend() {
        return hasDividendInfo() && !dividendCredited && dividendEntitledShares() > 0;
    }

    /** Records the close on the business day before the ex-dividend date. */
    public void recordPreExPrice(BigDecimal price) {
        requireOpen();
        this.preExPrice = price;
    }

    /**
     * Shares held at the end of the day before {@code date}, i.e. from trades dated strictly
     * earlier. Used to find the shares entitled to a dividend with the given ex-date.
     */
    public int sharesHeldBefore(LocalDate date) {
        int held = 0;
        for (Trade trade : trades) {
            if (trade.getDate().isBefore(date)) {
                held += trade.isBuy() ? trade.getShares() : -trade.getShares();
            }
        }
        return held;
    }

    /** Sum of bought shares minus sum of sold shares over this position's own trades. */
    public int sharesFromTrades() {
        return trades.stream()
                .mapToInt(t -> t.isBuy() ? t.getShares() : -t.getShares())
                .sum();
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean hasDividendInfo() {
        return exDividendDate != null && dividendPerShare != null;
    }

    /** Entry price x opening share count. */
    public BigDecimal getInitialValue() {
        return entryPrice.multiply(BigDecimal.valueOf(initialShares));
    }

    public BigDecimal marketValue(BigDecimal price) {
        return isOpen() ? price.multiply(BigDecimal.valueOf(shares)) : BigDecimal.ZERO;
    }

    /** (price - averageCost) x shares; zero once closed. */
    public BigDecimal unrealizedPnl(BigDecimal price) {
        if (!isOpen() || shares == 0) {
            return BigDecimal.ZERO;
        }
        return price.subtract(averageCost).multiply(BigDecimal.valueOf(shares));
    }

    /** Calendar days from entry to exit, or to {@code asOf} while still open. */
    public long holdingDays(LocalDate asOf) {
        LocalDate end = exitDate != null ? exitDate : asOf;
        return ChronoUnit.DAYS.between(entryDate, end);
    }

    public PositionContext toContext() {
        return PositionContext.builder()
                .instrument(instrument)
                .entryDate(entryDate)
                .entryPrice(entryPrice)
                .averagePrice(averageCost)
                .totalShares(shares)
                .initialValue(getInitialValue())
                .exDividendDate(exDividendDate)
                .preExPrice(preExPrice)
                .build();
    }

    private void requireOpen() {
        if (status != PositionStatus.OPEN) {
            throw new IllegalStateException("Position for " + instrument + " is already closed");
        }
    }

    private void requireSameInstrument(Trade trade) {
        if (!instrument.equals(trade.getInstrument())) {
            throw new IllegalArgumentException(
                    "Trade for " + trade.getInstrument() + " applied to position in " + instrument);
        }
    }
}
