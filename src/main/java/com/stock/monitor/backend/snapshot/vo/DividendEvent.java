package com.stock.monitor.backend.snapshot.vo;

import java.time.LocalDate;

public record DividendEvent(String symbol, String name, LocalDate exDate) {
}
