package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.RejectionReason;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a portfolio operation. Rejections are ordinary results, not exceptions:
 * a rejected operation leaves cash and positions untouched.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionResult {

    boolean success;
    RejectionReason rejectionReason;
    String message;

    /** The fill recorded by a successful buy or sell; null for dividend credits and rejections. */
    Trade trade;

    Position position;

    /** Cash credited by a successful dividend payment; zero otherwise. */
    BigDecimal cashCredited;

    public static ExecutionResult filled(Trade trade, Position position) {
        return new ExecutionResult(true, null, "filled", trade, position, BigDecimal.ZERO);
    }

    public static ExecutionResult credited(Position position, BigDecimal amount) {
        return new ExecutionResult(true, null, "dividend credited", null, position, amount);
    }

    public static ExecutionResult rejected(RejectionReason reason, String message) {
        return new ExecutionResult(false, reason, message, null, null, BigDecimal.ZERO);
    }

    public boolean isRejected() {
        return !success;
    }
}
