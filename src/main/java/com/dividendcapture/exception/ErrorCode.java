package com.dividendcapture.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIG_INVALID("CONFIG_INVALID", 2),
    DATA_VALIDATION_FAILED("DATA_VALIDATION_FAILED", 3),
    MARKET_DATA_UNREADABLE("MARKET_DATA_UNREADABLE", 4),
    OUTPUT_WRITE_FAILED("OUTPUT_WRITE_FAILED", 5),
    INTERNAL_ERROR("INTERNAL_ERROR", 1);

    private final String code;

    /** Process exit code reported by the command-line runner. */
    private final int exitCode;
}
