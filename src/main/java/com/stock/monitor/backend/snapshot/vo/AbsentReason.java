package com.stock.monitor.backend.snapshot.vo;

import com.stock.monitor.backend.exception.UpstreamErrorType;

public enum AbsentReason {
    NOT_FOUND,
    RATE_LIMITED,
    UNAVAILABLE,
    TIMEOUT,
    MALFORMED,
    DEADLINE_EXCEEDED,
    INTERRUPTED;

    public static AbsentReason from(UpstreamErrorType type) {
        return switch (type) {
            case NOT_FOUND -> NOT_FOUND;
            case RATE_LIMITED -> RATE_LIMITED;
            case TIMEOUT -> TIMEOUT;
            case MALFORMED -> MALFORMED;
            case UNAVAILABLE -> UNAVAILABLE;
        };
    }
}
