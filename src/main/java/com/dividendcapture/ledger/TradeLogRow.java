package com.dividendcapture.ledger;

import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.enums.TradeType;
import com.dividendcapture.domain.model.Trade;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One row of the exported trade log. Column order is stable across runs. */
@Value
@Builder
@JsonPropertyOrder({"date", "instrument", "type", "signalKind", "price", "shares", "amount", "commission", "reason"})
public class TradeLogRow {

    LocalDate date;
    String instrument;
    TradeType type;
    SignalKind signalKind;
    BigDecimal price;
    int shares;

    /** Cash moved by the trade, commission included. */
    BigDecimal amount;

    BigDecimal commission;
    String reason;

    public static TradeLogRow of(Trade trade) {
        return TradeLogRow.builder()
                .date(trade.getDate())
                .instrument(trade.getInstrument())
                .type(trade.getType())
                .signalKind(trade.getSignalKind())
                .price(trade.getPrice())
                .shares(trade.getShares())
                .amount(trade.getGrossAmount())
                .commission(trade.getCommission())
                .reason(trade.getReason())
                .build();
    }
}
