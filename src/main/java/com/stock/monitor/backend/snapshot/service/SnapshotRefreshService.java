package com.stock.monitor.backend.snapshot.service;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.exception.WatchlistUnavailableException;
import com.stock.monitor.backend.market.client.NewsClient;
import com.stock.monitor.backend.market.dto.NewsArticle;
import com.stock.monitor.backend.snapshot.analytics.AnalyticsEngine;
import com.stock.monitor.backend.snapshot.fetch.FetchScheduler;
import com.stock.monitor.backend.snapshot.vo.MarketSnapshot;
import com.stock.monitor.backend.snapshot.vo.RawSnapshot;
import com.stock.monitor.backend.watchlist.WatchlistEntry;
import com.stock.monitor.backend.watchlist.WatchlistService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * 리프레시 사이클 1회: 워치리스트 로드 → fetch fan-out/fan-in → 뉴스 → 분석 → 커밋.
 * - 외부 API 호출은 여기(스케줄러/수동 새로고침 경유)서만 한다
 * - 사이클은 한 번에 하나만 (in-flight 플래그)
 * - 워치리스트를 못 가져오면 커밋하지 않고 이전 스냅샷 유지
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotRefreshService {

    private final WatchlistService watchlistService;
    private final FetchScheduler fetchScheduler;
    private final NewsClient newsClient;
    private final AnalyticsEngine analyticsEngine;
    private final SnapshotCacheStore snapshotCacheStore;
    private final MonitorProperties properties;
    private final Clock clock;

    @Qualifier("refreshTriggerExecutor")
    private final ExecutorService refreshTriggerExecutor;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    @Getter
    private volatile String lastCycleError = null;

    /**
     * 진행 중인 사이클이 없으면 현재 스레드에서 1회 실행.
     * @return 실행했으면 true, 이미 진행 중이라 건너뛰었으면 false
     */
    public boolean refreshIfIdle() {
        if (!inFlight.compareAndSet(false, true)) {
            log.info("Refresh skipped. previous cycle still in flight");
            return false;
        }
        try {
            runCycle();
            return true;
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * 주기 밖 새로고침. 호출 스레드를 막지 않고 별도 스레드에서 실행한다.
     * @return 새 사이클을 시작했으면 true, 이미 진행 중이면 false (no-op)
     */
    public boolean forceRefresh() {
        if (!inFlight.compareAndSet(false, true)) {
            return false;
        }
        try {
            refreshTriggerExecutor.execute(() -> {
                try {
                    runCycle();
                } finally {
                    inFlight.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            log.warn("Refresh trigger rejected. msg={}", e.getMessage());
            return false;
        }
    }

    public boolean isRefreshing() {
        return inFlight.get();
    }

    private void runCycle() {
        long startedMs = System.currentTimeMillis();

        List<WatchlistEntry> watchlist;
        try {
            watchlist = watchlistService.loadActiveWatchlist();
        } catch (WatchlistUnavailableException e) {
            lastCycleError = "WATCHLIST_UNAVAILABLE: " + e.getMessage();
            log.error("Refresh cycle aborted, keep last success. reason={}", e.getMessage(), e);
            return;
        }

        try {
            RawSnapshot raw = fetchScheduler.fetchCycle(watchlist, properties.getIndices());
            raw = raw.toBuilder()
                    .watchlist(watchlist)
                    .news(fetchNewsSafe())
                    .build();

            Instant refreshedAt = clock.instant();
            MarketSnapshot snapshot = analyticsEngine.build(raw, refreshedAt);

            boolean committed = snapshotCacheStore.commit(snapshot);
            lastCycleError = committed ? null : "COMMIT_REJECTED: older than current snapshot";

            log.info("Snapshot refreshed. snapshotId={}, quotes={}, indices={}, news={}, failures={}, committed={}, elapsedMs={}",
                    snapshot.getSnapshotId(),
                    snapshot.getQuotes().size(),
                    snapshot.getIndices().size(),
                    snapshot.getNews().size(),
                    snapshot.getPartialFailureCount(),
                    committed,
                    System.currentTimeMillis() - startedMs);

        } catch (RuntimeException e) {
            lastCycleError = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Refresh cycle failed, keep last success.", e);
        }
    }

    private List<NewsArticle> fetchNewsSafe() {
        try {
            List<NewsArticle> news = newsClient.fetchMarketNews();
            return news == null ? List.of() : news;
        } catch (RuntimeException e) {
            log.warn("News fetch failed. continuing without news. ex={} msg={}",
                    e.getClass().getSimpleName(), e.getMessage());
            return List.of();
        }
    }
}
