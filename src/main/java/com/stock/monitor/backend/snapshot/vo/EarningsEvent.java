package com.stock.monitor.backend.snapshot.vo;

import java.time.LocalDate;

public record EarningsEvent(String symbol, String name, LocalDate date) {
}
