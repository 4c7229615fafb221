package com.stock.monitor.backend.snapshot.vo;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EarningsCalendar {
    Map<LocalDate, List<EarningsEvent>> byDate;
    List<DividendEvent> dividends;

    public static EarningsCalendar empty() {
        return EarningsCalendar.builder()
                .byDate(Map.of())
                .dividends(List.of())
                .build();
    }
}
