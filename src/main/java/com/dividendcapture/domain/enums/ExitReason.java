package com.dividendcapture.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a position was exited. Declaration order is the evaluation priority: when several
 * conditions hold on the same day the first one listed wins.
 */
@Getter
@RequiredArgsConstructor
public enum ExitReason {
    STOP_LOSS("stop_loss"),
    MAX_HOLDING_PERIOD("max_holding_period"),
    WINDOW_FILLED("window_filled");

    /** Stable key written to signal metadata and the positions summary. */
    private final String key;
}
