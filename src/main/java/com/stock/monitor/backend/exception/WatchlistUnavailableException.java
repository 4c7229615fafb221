package com.stock.monitor.backend.exception;

public class WatchlistUnavailableException extends RuntimeException {

    public WatchlistUnavailableException(String message) {
        super(message);
    }

    public WatchlistUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
