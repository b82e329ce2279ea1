package com.dividendcapture.domain.enums;

/**
 * Component of a backtest run that produced a journal entry.
 */
public enum DecisionSource {
    ENGINE,
    STRATEGY,
    PORTFOLIO,
    MARKET_DATA
}
