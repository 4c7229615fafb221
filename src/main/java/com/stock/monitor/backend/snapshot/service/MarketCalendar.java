package com.stock.monitor.backend.snapshot.service;

import com.stock.monitor.backend.config.MonitorProperties;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * NYSE 거래일 판정 (전일 휴장만, 조기 폐장은 거래일로 본다).
 * 토요일 휴일은 금요일, 일요일 휴일은 월요일에 대체. 단 토요일 신정은 대체 없음.
 */
@Component
@RequiredArgsConstructor
public class MarketCalendar {

    private final MonitorProperties properties;
    private final Clock clock;

    public boolean isTradingDayToday() {
        return isTradingDay(LocalDate.now(clock.withZone(ZoneId.of(properties.getSchedule().getZone()))));
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) return false;
        return !holidays(date.getYear()).contains(date);
    }

    public static Set<LocalDate> holidays(int year) {
        Set<LocalDate> out = new HashSet<>();

        LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
        if (newYear.getDayOfWeek() == DayOfWeek.SUNDAY) {
            out.add(newYear.plusDays(1));
        } else if (newYear.getDayOfWeek() != DayOfWeek.SATURDAY) {
            out.add(newYear);
        }

        out.add(nthWeekday(year, Month.JANUARY, DayOfWeek.MONDAY, 3));   // MLK
        out.add(nthWeekday(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));  // Presidents' Day
        out.add(easterSunday(year).minusDays(2));                        // Good Friday
        out.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
        if (year >= 2022) {
            out.add(observed(LocalDate.of(year, Month.JUNE, 19)));
        }
        out.add(observed(LocalDate.of(year, Month.JULY, 4)));
        out.add(nthWeekday(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1)); // Labor Day
        out.add(nthWeekday(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4)); // Thanksgiving
        out.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));

        return out;
    }

    private static LocalDate observed(LocalDate holiday) {
        return switch (holiday.getDayOfWeek()) {
            case SATURDAY -> holiday.minusDays(1);
            case SUNDAY -> holiday.plusDays(1);
            default -> holiday;
        };
    }

    private static LocalDate nthWeekday(int year, Month month, DayOfWeek dow, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Anonymous Gregorian algorithm
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
