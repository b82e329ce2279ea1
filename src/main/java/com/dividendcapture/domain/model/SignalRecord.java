package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.RejectionReason;
import com.dividendcapture.domain.enums.SignalKind;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One row of the signal history: what the strategy asked for and whether it was filled. */
@Value
@Builder
@JsonPropertyOrder({"date", "instrument", "kind", "price", "shares", "executed", "rejectionReason", "reason"})
public class SignalRecord {

    LocalDate date;
    String instrument;
    SignalKind kind;

    /** Fill price after slippage. */
    BigDecimal price;

    int shares;
    boolean executed;
    RejectionReason rejectionReason;
    String reason;
}
