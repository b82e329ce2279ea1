package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.enums.TradeType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * An executed fill. Immutable once created; owned by the position that recorded it and
 * mirrored into the registry's global trade log.
 *
 * <p>{@code grossAmount} is the cash that moved: price x shares + commission for a BUY,
 * price x shares - commission for a SELL. Use {@link #buy} and {@link #sell} to build
 * trades so the amount is always derived the same way.
 */
@Value
@Builder
public class Trade {

    String instrument;
    TradeType type;

    /** Signal kind that produced this fill (ENTRY, ADD or EXIT). */
    SignalKind signalKind;

    LocalDate date;
    BigDecimal price;
    int shares;
    BigDecimal commission;
    BigDecimal grossAmount;
    String reason;
    Map<String, Object> metadata;

    public static Trade buy(
            String instrument,
            SignalKind signalKind,
            LocalDate date,
            BigDecimal price,
            int shares,
            BigDecimal commission,
            String reason) {
        validate(price, shares, commission);
        return Trade.builder()
                .instrument(instrument)
                .type(TradeType.BUY)
                .signalKind(signalKind)
                .date(date)
                .price(price)
                .shares(shares)
                .commission(commission)
                .grossAmount(notional(price, shares).add(commission))
                .reason(reason)
                .metadata(Map.of())
                .build();
    }

    public static Trade sell(
            String instrument, LocalDate date, BigDecimal price, int shares, BigDecimal commission, String reason) {
        validate(price, shares, commission);
        return Trade.builder()
                .instrument(instrument)
                .type(TradeType.SELL)
                .signalKind(SignalKind.EXIT)
                .date(date)
                .price(price)
                .shares(shares)
                .commission(commission)
                .grossAmount(notional(price, shares).subtract(commission))
                .reason(reason)
                .metadata(Map.of())
                .build();
    }

    /** Price x shares, without commission. */
    public BigDecimal getNotional() {
        return notional(price, shares);
    }

    public boolean isBuy() {
        return type == TradeType.BUY;
    }

    private static BigDecimal notional(BigDecimal price, int shares) {
        return price.multiply(BigDecimal.valueOf(shares));
    }

    private static void validate(BigDecimal price, int shares, BigDecimal commission) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Trade price must be positive: " + price);
        }
        if (shares <= 0) {
            throw new IllegalArgumentException("Trade shares must be positive: " + shares);
        }
        if (commission == null || commission.signum() < 0) {
            throw new IllegalArgumentException("Trade commission must be non-negative: " + commission);
        }
    }
}
