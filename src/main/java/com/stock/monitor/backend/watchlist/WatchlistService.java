package com.stock.monitor.backend.watchlist;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.exception.WatchlistUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 사이클마다 워치리스트를 1회 로드.
 * 폴백 순서: provider → 마지막 성공 목록(last-good-max-age 이내) → 설정 파일 목록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatchlistService {

    private final WatchlistProvider provider;
    private final MonitorProperties properties;
    private final Clock clock;

    private volatile List<WatchlistEntry> lastGood = null;
    private volatile Instant lastGoodAt = null;

    public List<WatchlistEntry> loadActiveWatchlist() {
        List<String> statuses = properties.getWatchlist().getActiveStatuses();

        try {
            List<WatchlistEntry> loaded = dedupe(provider.listWatchlist(statuses));
            if (!loaded.isEmpty()) {
                lastGood = loaded;
                lastGoodAt = clock.instant();
                return loaded;
            }
            log.warn("Watchlist provider returned 0 symbols. provider={}", provider.name());

        } catch (WatchlistUnavailableException e) {
            log.warn("Watchlist provider unavailable. provider={} msg={}", provider.name(), e.getMessage());
        }

        List<WatchlistEntry> cached = lastGood;
        Instant cachedAt = lastGoodAt;
        if (cached != null && cachedAt != null) {
            Duration age = Duration.between(cachedAt, clock.instant());
            if (age.compareTo(properties.getWatchlist().getLastGoodMaxAge()) <= 0) {
                log.info("Using last good watchlist. size={} ageMinutes={}", cached.size(), age.toMinutes());
                return cached;
            }
        }

        List<WatchlistEntry> configured = dedupe(
                ConfiguredWatchlistProvider.toEntries(properties.getWatchlist().getEntries()));
        if (!configured.isEmpty()) {
            log.info("Using configured fallback watchlist. size={}", configured.size());
            return configured;
        }

        throw new WatchlistUnavailableException("워치리스트를 불러올 수 없습니다. provider=" + provider.name());
    }

    // 같은 심볼은 처음 나온 행만 유지
    private static List<WatchlistEntry> dedupe(List<WatchlistEntry> entries) {
        if (entries == null) return List.of();
        Map<String, WatchlistEntry> bySymbol = new LinkedHashMap<>();
        for (WatchlistEntry e : entries) {
            if (e == null || e.getSymbol() == null || e.getSymbol().isBlank()) continue;
            bySymbol.putIfAbsent(e.getSymbol(), e);
        }
        return List.copyOf(bySymbol.values());
    }
}
