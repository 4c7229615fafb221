package com.stock.monitor.backend.snapshot.service;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketCalendarTest {

    @Test
    void weekends_are_not_trading_days() {
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 3, 1)));
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 3, 2)));
        assertTrue(MarketCalendar.isTradingDay(LocalDate.of(2025, 3, 3)));
    }

    @Test
    void good_friday_follows_easter() {
        assertEquals(LocalDate.of(2025, 4, 20), MarketCalendar.easterSunday(2025));
        assertEquals(LocalDate.of(2024, 3, 31), MarketCalendar.easterSunday(2024));
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2024, 3, 29)));
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 4, 18)));
    }

    @Test
    void floating_holidays() {
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 1, 20)));  // MLK
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 2, 17)));  // Presidents' Day
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 5, 26)));  // Memorial Day
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 9, 1)));   // Labor Day
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 11, 27))); // Thanksgiving
        assertTrue(MarketCalendar.isTradingDay(LocalDate.of(2025, 11, 28)));
    }

    @Test
    void weekend_holidays_are_observed_on_adjacent_weekday() {
        // 2026-07-04 토요일 → 7/3 금요일
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2026, 7, 3)));
        // 2022-12-25 일요일 → 12/26 월요일
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2022, 12, 26)));
        // 2027-06-19 토요일 → 6/18 금요일
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2027, 6, 18)));
        // 2023-01-01 일요일 → 1/2 월요일
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2023, 1, 2)));
    }

    @Test
    void saturday_new_year_has_no_friday_observance() {
        // 2022-01-01 토요일: 2021-12-31은 정상 거래
        assertTrue(MarketCalendar.isTradingDay(LocalDate.of(2021, 12, 31)));
    }

    @Test
    void juneteenth_only_from_2022() {
        assertTrue(MarketCalendar.isTradingDay(LocalDate.of(2021, 6, 18)));
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2025, 6, 19)));
    }
}
