package com.stock.monitor.backend.snapshot.vo;

public enum IndexKind {
    INDEX,
    // 지수 레벨 자체가 의미. 매매 가능한 가격이 아님
    VOLATILITY,
    FUTURE
}
