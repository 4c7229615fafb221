package com.stock.monitor.backend.exception;

import lombok.Getter;

/**
 * 외부 시세/뉴스 API 호출 실패.
 * - type으로 재시도 여부와 absent 사유를 결정한다.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final UpstreamErrorType type;
    private final String symbol;

    public UpstreamException(UpstreamErrorType type, String symbol, String message) {
        super(message);
        this.type = type;
        this.symbol = symbol;
    }

    public UpstreamException(UpstreamErrorType type, String symbol, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.symbol = symbol;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
