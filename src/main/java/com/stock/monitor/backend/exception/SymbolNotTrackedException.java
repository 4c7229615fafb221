package com.stock.monitor.backend.exception;

import lombok.Getter;

@Getter
public class SymbolNotTrackedException extends RuntimeException {

    private final String symbol;

    public SymbolNotTrackedException(String symbol) {
        super("워치리스트에 없는 심볼입니다. symbol=" + symbol);
        this.symbol = symbol;
    }
}
