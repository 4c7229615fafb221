package com.stock.monitor.backend.snapshot.vo;

public enum SymbolKind {
    // 정규장/프리·애프터마켓 구분이 있는 종목
    EQUITY,
    // 24시간 거래 (예: BTC-USD)
    ALWAYS_OPEN
}
