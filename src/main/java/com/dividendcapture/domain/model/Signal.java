package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.ExitReason;
import com.dividendcapture.domain.enums.SignalKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A trading decision emitted by the strategy and consumed exactly once by the engine.
 * {@code price} is the observed close the decision was made on; the engine applies
 * slippage when it turns the signal into an order.
 */
@Value
@Builder
public class Signal {

    String instrument;
    SignalKind kind;
    LocalDate date;
    BigDecimal price;
    int shares;
    String reason;

    /** Set only on EXIT signals. */
    ExitReason exitReason;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
