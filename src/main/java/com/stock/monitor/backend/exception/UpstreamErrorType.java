package com.stock.monitor.backend.exception;

public enum UpstreamErrorType {
    UNAVAILABLE(true),
    TIMEOUT(true),
    RATE_LIMITED(true),
    NOT_FOUND(false),
    MALFORMED(false);

    private final boolean retryable;

    UpstreamErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
