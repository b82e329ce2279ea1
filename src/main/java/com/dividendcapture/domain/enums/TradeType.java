package com.dividendcapture.domain.enums;

/** Buy or sell side of an executed trade. */
public enum TradeType {
    BUY,
    SELL
}
