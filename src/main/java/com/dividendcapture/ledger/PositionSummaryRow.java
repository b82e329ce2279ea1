package com.dividendcapture.ledger;

import com.dividendcapture.domain.enums.PositionStatus;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.Trade;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the exported positions summary, open or closed.
 */
@Value
@Builder
@JsonPropertyOrder({
    "instrument", "status", "entryDate", "entryPrice", "initialShares", "sharesBought", "shares",
    "averageCost", "exDividendDate", "recordDate", "dividendPerShare", "preExPrice", "dividendReceived",
    "exitDate", "exitPrice", "exitReason", "realizedPnL", "totalCommission", "holdingDays", "tradeCount"
})
public class PositionSummaryRow {

    String instrument;
    PositionStatus status;
    LocalDate entryDate;
    BigDecimal entryPrice;
    int initialShares;

    /** Shares bought over the whole life of the position, additions included. */
    int sharesBought;

    /** Shares currently held; zero once closed. */
    int shares;

    BigDecimal averageCost;
    LocalDate exDividendDate;
    LocalDate recordDate;
    BigDecimal dividendPerShare;
    BigDecimal preExPrice;
    BigDecimal dividendReceived;
    LocalDate exitDate;
    BigDecimal exitPrice;
    String exitReason;
    BigDecimal realizedPnL;
    BigDecimal totalCommission;

    /** Calendar days held; up to {@code asOf} for open positions. */
    long holdingDays;

    int tradeCount;

    public static PositionSummaryRow of(Position position, LocalDate asOf) {
        int sharesBought = position.getTrades().stream()
                .filter(Trade::isBuy)
                .mapToInt(Trade::getShares)
                .sum();
        return PositionSummaryRow.builder()
                .instrument(position.getInstrument())
                .status(position.getStatus())
                .entryDate(position.getEntryDate())
                .entryPrice(position.getEntryPrice())
                .initialShares(position.getInitialShares())
                .sharesBought(sharesBought)
                .shares(position.getShares())
                .averageCost(position.getAverageCost())
                .exDividendDate(position.getExDividendDate())
                .recordDate(position.getRecordDate())
                .dividendPerShare(position.getDividendPerShare())
                .preExPrice(position.getPreExPrice())
                .dividendReceived(position.getDividendReceivedTotal())
                .exitDate(position.getExitDate())
                .exitPrice(position.getExitPrice())
                .exitReason(position.getExitReason())
                .realizedPnL(position.getRealizedPnL())
                .totalCommission(position.getTotalCommission())
                .holdingDays(position.holdingDays(asOf))
                .tradeCount(position.getTrades().size())
                .build();
    }
}
