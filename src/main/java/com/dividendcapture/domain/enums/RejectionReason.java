package com.dividendcapture.domain.enums;

/**
 * Expected, non-fatal reasons an execution request is declined. The run continues and the
 * rejection is reported through the result value and the journal.
 */
public enum RejectionReason {
    /** Price x shares + commission exceeds available cash. */
    INSUFFICIENT_CASH,
    /** An ENTRY buy for an instrument that already has an open position. */
    DUPLICATE_ENTRY,
    /** A sell, addition or dividend credit for an instrument with no open position. */
    NO_POSITION,
    /** Non-positive price or share count, or a negative commission. */
    INVALID_ORDER,
    /** The position's dividend has already been credited once. */
    DIVIDEND_ALREADY_CREDITED,
    /** No shares were held before the ex-dividend date. */
    NOT_ENTITLED,
    /** The strategy's pre-trade validation declined the signal (position cap or cash). */
    SIGNAL_REJECTED
}
