package com.dividendcapture.domain.enums;

/** Level at which a journal entry is mirrored to the application log. */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING
}
