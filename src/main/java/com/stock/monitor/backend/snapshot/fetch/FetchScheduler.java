package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.market.client.MarketDataClient;
import com.stock.monitor.backend.snapshot.vo.AbsentReason;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.RawSnapshot;
import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import com.stock.monitor.backend.watchlist.WatchlistEntry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 워치리스트 + 지수/선물 심볼을 고정 크기 워커 풀에 1심볼 1태스크로 분배하고,
 * 모든 태스크가 끝나거나 사이클 데드라인이 지나면 결과를 모은다.
 * - 캐시에 직접 쓰지 않는다
 * - 데드라인 이후 미완료 태스크는 취소 후 DEADLINE_EXCEEDED
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FetchScheduler {

    private final MarketDataClient marketDataClient;
    private final SymbolClassifier symbolClassifier;
    private final DelistedSymbolRegistry delistedSymbolRegistry;
    private final MonitorProperties properties;

    @Qualifier("quoteFetchExecutor")
    private final ExecutorService quoteFetchExecutor;

    public RawSnapshot fetchCycle(List<WatchlistEntry> watchlist, List<MonitorProperties.IndexSpec> indices) {
        long startedNs = System.nanoTime();
        MonitorProperties.Fetch cfg = properties.getFetch();

        RequestPacer pacer = new RequestPacer(
                cfg.getJitterMin(), cfg.getJitterMax(), cfg.getRateLimitStep(), cfg.getRateLimitMaxSpacing());

        Map<String, Future<QuoteResult>> quoteFutures = new LinkedHashMap<>();
        Map<String, QuoteResult> quotes = new LinkedHashMap<>();
        for (WatchlistEntry entry : watchlist) {
            SymbolKind kind = symbolClassifier.classify(entry.getSymbol());
            FetchRequest req = new FetchRequest(entry.getSymbol(), kind, kind == SymbolKind.EQUITY,
                    entry.getCompanyName(), entry.getSector());
            dispatch(req, pacer, quoteFutures, quotes);
        }

        Map<String, Future<QuoteResult>> indexFutures = new LinkedHashMap<>();
        Map<String, QuoteResult> indexResults = new LinkedHashMap<>();
        for (MonitorProperties.IndexSpec spec : indices) {
            // 지수/선물은 캘린더·프리마켓 대상 아님
            FetchRequest req = new FetchRequest(spec.getSymbol(), SymbolKind.ALWAYS_OPEN, false, spec.getName(), null);
            dispatch(req, pacer, indexFutures, indexResults);
        }

        long deadlineNs = startedNs + cfg.getCycleDeadline().toNanos();
        settle(quoteFutures, quotes, deadlineNs);
        settle(indexFutures, indexResults, deadlineNs);

        RawSnapshot raw = RawSnapshot.builder()
                .watchlist(List.copyOf(watchlist))
                .quotes(reorder(watchlist.stream().map(WatchlistEntry::getSymbol).toList(), quotes))
                .indices(reorder(indices.stream().map(MonitorProperties.IndexSpec::getSymbol).toList(), indexResults))
                .news(List.of())
                .build();

        log.info("Fetch cycle settled. symbols={}, indices={}, failures={}, elapsedMs={}",
                quotes.size(), indexResults.size(), raw.failureCount(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs));
        return raw;
    }

    private void dispatch(FetchRequest req,
                          RequestPacer pacer,
                          Map<String, Future<QuoteResult>> futures,
                          Map<String, QuoteResult> settled) {
        String symbol = req.symbol();

        if (delistedSymbolRegistry.isSuppressed(symbol)) {
            settled.put(symbol, QuoteResult.absent(symbol, AbsentReason.NOT_FOUND, "not found earlier, skipped until recheck"));
            return;
        }

        MonitorProperties.Fetch cfg = properties.getFetch();
        SymbolFetchTask task = new SymbolFetchTask(
                req, marketDataClient, pacer, cfg.getMaxRetries(), cfg.getRetryBackoff(), cfg.getHistoryDays());
        try {
            futures.put(symbol, quoteFetchExecutor.submit(task));
        } catch (RejectedExecutionException e) {
            log.warn("Fetch task rejected. symbol={} msg={}", symbol, e.getMessage());
            settled.put(symbol, QuoteResult.absent(symbol, AbsentReason.UNAVAILABLE, "worker pool rejected task"));
        }
    }

    private void settle(Map<String, Future<QuoteResult>> futures, Map<String, QuoteResult> settled, long deadlineNs) {
        for (Map.Entry<String, Future<QuoteResult>> e : futures.entrySet()) {
            String symbol = e.getKey();
            Future<QuoteResult> future = e.getValue();

            QuoteResult result;
            try {
                long remaining = Math.max(0, deadlineNs - System.nanoTime());
                result = future.get(remaining, TimeUnit.NANOSECONDS);

            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Cycle deadline exceeded, giving up on symbol={}", symbol);
                result = QuoteResult.absent(symbol, AbsentReason.DEADLINE_EXCEEDED, "cycle deadline exceeded");

            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                AbsentReason reason = (cause instanceof InterruptedException)
                        ? AbsentReason.INTERRUPTED
                        : AbsentReason.UNAVAILABLE;
                log.warn("Fetch task failed. symbol={} ex={} msg={}",
                        symbol, cause.getClass().getSimpleName(), cause.getMessage());
                result = QuoteResult.absent(symbol, reason, cause.getMessage());

            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                result = QuoteResult.absent(symbol, AbsentReason.INTERRUPTED, "coordinator interrupted");
            }

            if (!result.isPresent() && result.getReason() == AbsentReason.NOT_FOUND) {
                delistedSymbolRegistry.markNotFound(symbol);
            } else if (result.isPresent()) {
                delistedSymbolRegistry.clear(symbol);
            }
            settled.put(symbol, result);
        }
    }

    private static Map<String, QuoteResult> reorder(List<String> order, Map<String, QuoteResult> settled) {
        Map<String, QuoteResult> out = new LinkedHashMap<>();
        for (String symbol : order) {
            QuoteResult r = settled.get(symbol);
            if (r != null) out.put(symbol, r);
        }
        return Collections.unmodifiableMap(out);
    }
}
