package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.config.MonitorProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * NOT_FOUND 심볼을 기억해서 not-found-recheck 동안은 호출하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class DelistedSymbolRegistry {

    private final MonitorProperties properties;
    private final Clock clock;

    private final Map<String, Instant> notFoundAt = new ConcurrentHashMap<>();

    public void markNotFound(String symbol) {
        notFoundAt.put(symbol, clock.instant());
    }

    public boolean isSuppressed(String symbol) {
        Instant markedAt = notFoundAt.get(symbol);
        if (markedAt == null) return false;

        Instant recheckAt = markedAt.plus(properties.getFetch().getNotFoundRecheck());
        if (clock.instant().isBefore(recheckAt)) return true;

        notFoundAt.remove(symbol, markedAt);
        return false;
    }

    public void clear(String symbol) {
        notFoundAt.remove(symbol);
    }
}
