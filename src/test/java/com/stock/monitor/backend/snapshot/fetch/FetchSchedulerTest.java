package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.exception.UpstreamErrorType;
import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.client.MarketDataClient;
import com.stock.monitor.backend.market.dto.CalendarDates;
import com.stock.monitor.backend.snapshot.vo.AbsentReason;
import com.stock.monitor.backend.snapshot.vo.IndexKind;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.RawSnapshot;
import com.stock.monitor.backend.support.Fixtures;
import com.stock.monitor.backend.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.stock.monitor.backend.support.Fixtures.entry;
import static com.stock.monitor.backend.support.Fixtures.quote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchSchedulerTest {

    @Mock MarketDataClient client;

    MonitorProperties properties;
    MutableClock clock;
    DelistedSymbolRegistry registry;
    ExecutorService executor;
    FetchScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = Fixtures.fastProperties();
        clock = new MutableClock(Instant.parse("2025-03-03T15:00:00Z"));
        registry = new DelistedSymbolRegistry(properties, clock);
        executor = Executors.newFixedThreadPool(4);
        scheduler = new FetchScheduler(client, new SymbolClassifier(List.of("-USD")), registry, properties, executor);

        lenient().when(client.fetchHistory(anyString(), anyInt())).thenReturn(List.of(100.0, 101.0, 102.0));
        lenient().when(client.fetchCalendar(anyString())).thenReturn(CalendarDates.none());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void one_symbol_failing_after_retries_becomes_absent_and_siblings_survive() {
        // given
        when(client.fetchQuote(anyString())).thenAnswer(inv -> {
            String symbol = inv.getArgument(0);
            if (symbol.equals("CCC")) {
                throw new UpstreamException(UpstreamErrorType.UNAVAILABLE, symbol, "connection reset");
            }
            return quote(symbol, 105.0, 100.0);
        });

        // when
        RawSnapshot raw = scheduler.fetchCycle(
                List.of(entry("AAA", "Tech"), entry("BBB", "Tech"), entry("CCC", "Energy")), List.of());

        // then
        assertEquals(List.of("AAA", "BBB", "CCC"), List.copyOf(raw.getQuotes().keySet()));
        assertTrue(raw.getQuotes().get("AAA").isPresent());
        assertTrue(raw.getQuotes().get("BBB").isPresent());

        QuoteResult ccc = raw.getQuotes().get("CCC");
        assertFalse(ccc.isPresent());
        assertEquals(AbsentReason.UNAVAILABLE, ccc.getReason());
        assertEquals(1, raw.failureCount());

        // 최초 1회 + 재시도 2회
        verify(client, times(3)).fetchQuote("CCC");
        verify(client, times(1)).fetchQuote("AAA");
    }

    @Test
    void not_found_is_not_retried_and_is_skipped_next_cycle() {
        // given
        when(client.fetchQuote("GONE"))
                .thenThrow(new UpstreamException(UpstreamErrorType.NOT_FOUND, "GONE", "no data, possibly delisted"));

        // when
        RawSnapshot first = scheduler.fetchCycle(List.of(entry("GONE", "Tech")), List.of());
        RawSnapshot second = scheduler.fetchCycle(List.of(entry("GONE", "Tech")), List.of());

        // then
        assertEquals(AbsentReason.NOT_FOUND, first.getQuotes().get("GONE").getReason());
        assertEquals(AbsentReason.NOT_FOUND, second.getQuotes().get("GONE").getReason());
        verify(client, times(1)).fetchQuote("GONE");
    }

    @Test
    void not_found_symbol_is_rechecked_after_recheck_window() {
        // given
        when(client.fetchQuote("GONE"))
                .thenThrow(new UpstreamException(UpstreamErrorType.NOT_FOUND, "GONE", "not found"))
                .thenReturn(quote("GONE", 10.0, 9.0));

        scheduler.fetchCycle(List.of(entry("GONE", null)), List.of());

        // when
        clock.advance(properties.getFetch().getNotFoundRecheck().plusSeconds(1));
        RawSnapshot later = scheduler.fetchCycle(List.of(entry("GONE", null)), List.of());

        // then
        assertTrue(later.getQuotes().get("GONE").isPresent());
        assertFalse(registry.isSuppressed("GONE"));
        verify(client, times(2)).fetchQuote("GONE");
    }

    @Test
    void slow_symbol_is_marked_deadline_exceeded_and_others_are_kept() {
        // given
        properties.getFetch().setCycleDeadline(Duration.ofMillis(300));
        CountDownLatch neverReleased = new CountDownLatch(1);

        when(client.fetchQuote(anyString())).thenAnswer(inv -> {
            String symbol = inv.getArgument(0);
            if (symbol.equals("SLOW")) {
                neverReleased.await(10, TimeUnit.SECONDS);
            }
            return quote(symbol, 50.0, 49.0);
        });

        // when
        long started = System.nanoTime();
        RawSnapshot raw = scheduler.fetchCycle(List.of(entry("SLOW", "Tech"), entry("FAST", "Tech")), List.of());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        assertEquals(AbsentReason.DEADLINE_EXCEEDED, raw.getQuotes().get("SLOW").getReason());
        assertTrue(raw.getQuotes().get("FAST").isPresent());
        assertTrue(elapsedMs < 5_000, "cycle should not wait for the slow symbol, took " + elapsedMs + "ms");
    }

    @Test
    void always_open_symbol_skips_calendar_and_extended_hours_fields() {
        // given
        when(client.fetchQuote(anyString())).thenAnswer(inv -> quote(inv.getArgument(0), 105.0, 100.0).toBuilder()
                .preMarketPrice(106.0)
                .build());
        when(client.fetchCalendar("AAPL")).thenReturn(new CalendarDates(LocalDate.of(2025, 3, 10), null));

        // when
        RawSnapshot raw = scheduler.fetchCycle(List.of(entry("AAPL", "Tech"), entry("BTC-USD", null)), List.of());

        // then
        verify(client, never()).fetchCalendar("BTC-USD");
        verify(client, times(1)).fetchCalendar("AAPL");

        assertNull(raw.getQuotes().get("BTC-USD").getRecord().getPreMarketPrice());
        assertEquals(106.0, raw.getQuotes().get("AAPL").getRecord().getPreMarketPrice());
        assertEquals(LocalDate.of(2025, 3, 10), raw.getQuotes().get("AAPL").getRecord().getNextEarningsDate());
    }

    @Test
    void history_failure_keeps_partial_record() {
        // given
        when(client.fetchQuote("AAA")).thenReturn(quote("AAA", 105.0, 100.0));
        when(client.fetchHistory("AAA", 7))
                .thenThrow(new UpstreamException(UpstreamErrorType.MALFORMED, "AAA", "chart closes missing"));

        // when
        RawSnapshot raw = scheduler.fetchCycle(List.of(entry("AAA", "Tech")), List.of());

        // then
        QuoteResult aaa = raw.getQuotes().get("AAA");
        assertTrue(aaa.isPresent());
        assertTrue(aaa.getRecord().getDailyCloses().isEmpty());
        assertNull(aaa.getRecord().getWeekChangePercent());
        assertEquals(5.0, aaa.getRecord().getChangePercent(), 1e-9);
    }

    @Test
    void index_symbols_are_fetched_without_calendar_and_counted_as_failures() {
        // given
        when(client.fetchQuote(anyString())).thenAnswer(inv -> {
            String symbol = inv.getArgument(0);
            if (symbol.equals("^VIX")) {
                throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol, "regularMarketPrice missing");
            }
            return quote(symbol, 5100.0, 5000.0);
        });
        List<MonitorProperties.IndexSpec> indices = List.of(
                new MonitorProperties.IndexSpec("^GSPC", "S&P 500", IndexKind.INDEX),
                new MonitorProperties.IndexSpec("^VIX", "VIX", IndexKind.VOLATILITY));

        // when
        RawSnapshot raw = scheduler.fetchCycle(List.of(), indices);

        // then
        assertTrue(raw.getIndices().get("^GSPC").isPresent());
        assertEquals(AbsentReason.MALFORMED, raw.getIndices().get("^VIX").getReason());
        assertEquals(1, raw.failureCount());
        verify(client, never()).fetchCalendar(anyString());
        // MALFORMED는 재시도 대상 아님
        verify(client, times(1)).fetchQuote("^VIX");
    }
}
