package com.dividendcapture.domain.enums;

/**
 * Closed set of signal kinds produced by the strategy.
 *
 * <p>The kind travels with every execution request so the portfolio routes a buy as an
 * opening trade or as an addition by tag, never by inspecting the free-text reason.
 */
public enum SignalKind {
    ENTRY,
    ADD,
    EXIT;

    public boolean isBuy() {
        return this != EXIT;
    }
}
