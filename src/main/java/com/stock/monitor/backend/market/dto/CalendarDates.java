package com.stock.monitor.backend.market.dto;

import java.time.LocalDate;

public record CalendarDates(LocalDate nextEarningsDate, LocalDate nextExDividendDate) {

    public static CalendarDates none() {
        return new CalendarDates(null, null);
    }
}
