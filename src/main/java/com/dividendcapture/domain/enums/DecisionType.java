package com.dividendcapture.domain.enums;

/**
 * Kind of event recorded in the backtest journal.
 *
 * <p>Signal types record what the strategy proposed; trade and dividend types record what
 * the portfolio actually did with it.
 */
public enum DecisionType {
    // Run lifecycle
    RUN_STARTED,
    RUN_PROGRESS,
    RUN_COMPLETED,
    DATA_VALIDATED,

    // Strategy
    ENTRY_SIGNAL,
    ADD_SIGNAL,
    EXIT_SIGNAL,

    // Portfolio
    POSITION_OPENED,
    POSITION_ADDED,
    POSITION_CLOSED,
    DIVIDEND_CREDITED,
    PRE_EX_PRICE_RECORDED,
    PRICE_MISSING
}
