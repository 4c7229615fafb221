package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.exception.UpstreamErrorType;
import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.client.MarketDataClient;
import com.stock.monitor.backend.market.dto.CalendarDates;
import com.stock.monitor.backend.market.dto.UpstreamQuote;
import com.stock.monitor.backend.snapshot.vo.AbsentReason;
import com.stock.monitor.backend.snapshot.vo.QuoteRecord;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 심볼 1개: quote → 일봉 종가 → (EQUITY면) 캘린더.
 * - quote 실패(재시도 소진)면 ABSENT
 * - 히스토리/캘린더 실패는 해당 필드만 비운 부분 레코드
 * - 실패는 이 경계 밖으로 던지지 않는다 (인터럽트 제외)
 */
@Slf4j
public class SymbolFetchTask implements Callable<QuoteResult> {

    private final FetchRequest request;
    private final MarketDataClient client;
    private final RequestPacer pacer;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final int historyDays;

    public SymbolFetchTask(FetchRequest request,
                           MarketDataClient client,
                           RequestPacer pacer,
                           int maxRetries,
                           Duration retryBackoff,
                           int historyDays) {
        this.request = request;
        this.client = client;
        this.pacer = pacer;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.historyDays = historyDays;
    }

    @Override
    public QuoteResult call() throws InterruptedException {
        String symbol = request.symbol();

        UpstreamQuote quote;
        try {
            quote = withRetry("quote", () -> client.fetchQuote(symbol));
        } catch (UpstreamException e) {
            log.warn("Quote fetch gave up. symbol={} type={} msg={}", symbol, e.getType(), e.getMessage());
            return QuoteResult.absent(symbol, AbsentReason.from(e.getType()), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Quote fetch failed unexpectedly. symbol={} ex={} msg={}",
                    symbol, e.getClass().getSimpleName(), e.getMessage());
            return QuoteResult.absent(symbol, AbsentReason.MALFORMED, e.getMessage());
        }

        List<Double> closes = fetchHistorySafe(symbol);
        CalendarDates calendar = request.includeCalendar() ? fetchCalendarSafe(symbol) : CalendarDates.none();

        return QuoteResult.present(assemble(request, quote, closes, calendar));
    }

    private List<Double> fetchHistorySafe(String symbol) throws InterruptedException {
        try {
            List<Double> closes = withRetry("history", () -> client.fetchHistory(symbol, historyDays));
            return closes == null ? List.of() : closes;
        } catch (RuntimeException e) {
            log.warn("History fetch failed. symbol={} ex={} msg={}", symbol, e.getClass().getSimpleName(), e.getMessage());
            return List.of();
        }
    }

    private CalendarDates fetchCalendarSafe(String symbol) throws InterruptedException {
        try {
            CalendarDates dates = withRetry("calendar", () -> client.fetchCalendar(symbol));
            return dates == null ? CalendarDates.none() : dates;
        } catch (RuntimeException e) {
            log.debug("Calendar fetch failed. symbol={} ex={} msg={}", symbol, e.getClass().getSimpleName(), e.getMessage());
            return CalendarDates.none();
        }
    }

    private <T> T withRetry(String call, Supplier<T> fetch) throws InterruptedException {
        for (int attempt = 0; ; attempt++) {
            pacer.pause();
            try {
                return fetch.get();
            } catch (UpstreamException e) {
                if (e.getType() == UpstreamErrorType.RATE_LIMITED) {
                    pacer.onRateLimited();
                }
                if (!e.isRetryable() || attempt >= maxRetries) {
                    throw e;
                }
                log.debug("Retrying {} symbol={} attempt={}/{} type={}",
                        call, request.symbol(), attempt + 1, maxRetries, e.getType());
                Thread.sleep(retryBackoff.toMillis() * (attempt + 1));
            }
        }
    }

    static QuoteRecord assemble(FetchRequest request, UpstreamQuote q, List<Double> closes, CalendarDates calendar) {
        boolean equity = request.kind() == SymbolKind.EQUITY;

        Double price = q.getPrice();
        Double prev = q.getPreviousClose();

        Double volumeRatio = (q.getVolume() != null && q.getAvgVolume() != null && q.getAvgVolume() > 0)
                ? (double) q.getVolume() / q.getAvgVolume()
                : null;

        Double weekChange = (closes != null && closes.size() >= 2)
                ? QuoteRecord.changePercentOf(closes.get(closes.size() - 1), closes.get(0))
                : null;

        String name = q.getShortName() != null ? q.getShortName()
                : request.displayName() != null ? request.displayName()
                : request.symbol();

        return QuoteRecord.builder()
                .symbol(request.symbol())
                .name(name)
                .kind(request.kind())
                .sector(request.sector())
                .price(price)
                .change(QuoteRecord.changeOf(price, prev))
                .changePercent(QuoteRecord.changePercentOf(price, prev))
                .open(q.getOpen())
                .dayHigh(q.getDayHigh())
                .dayLow(q.getDayLow())
                .previousClose(prev)
                .volume(q.getVolume())
                .avgVolume(q.getAvgVolume())
                .volumeRatio(volumeRatio)
                .marketCap(q.getMarketCap())
                .dailyCloses(closes)
                .weekChangePercent(weekChange)
                // 프리: 전일 종가 대비 / 애프터: 정규장 가격 대비
                .preMarketPrice(equity ? q.getPreMarketPrice() : null)
                .preMarketChangePercent(equity ? QuoteRecord.changePercentOf(q.getPreMarketPrice(), prev) : null)
                .postMarketPrice(equity ? q.getPostMarketPrice() : null)
                .postMarketChangePercent(equity ? QuoteRecord.changePercentOf(q.getPostMarketPrice(), price) : null)
                .nextEarningsDate(calendar.nextEarningsDate())
                .nextExDividendDate(calendar.nextExDividendDate())
                .build();
    }
}
