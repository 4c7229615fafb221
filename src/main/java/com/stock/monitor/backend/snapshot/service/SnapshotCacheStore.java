package com.stock.monitor.backend.snapshot.service;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.snapshot.vo.MarketSnapshot;
import com.stock.monitor.backend.snapshot.vo.SnapshotView;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 현재 스냅샷 1개를 들고 있는 저장소.
 * - Empty → Populated, 이후 Empty로 돌아가지 않는다
 * - refreshedAt이 현재 것보다 이른 스냅샷은 커밋하지 않는다
 * - 자동 만료 없음 (TTL은 읽을 때 같이 돌려주는 참고값)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotCacheStore {

    private final MonitorProperties properties;
    private final Clock clock;

    private final AtomicReference<MarketSnapshot> current = new AtomicReference<>();

    public boolean commit(MarketSnapshot snapshot) {
        if (snapshot == null || snapshot.getRefreshedAt() == null) {
            throw new IllegalArgumentException("snapshot and refreshedAt are required");
        }

        while (true) {
            MarketSnapshot held = current.get();
            if (held != null && snapshot.getRefreshedAt().isBefore(held.getRefreshedAt())) {
                log.warn("Rejected out-of-order commit. incoming={} held={}",
                        snapshot.getRefreshedAt(), held.getRefreshedAt());
                return false;
            }
            if (current.compareAndSet(held, snapshot)) {
                return true;
            }
        }
    }

    public Optional<SnapshotView> currentSnapshot() {
        MarketSnapshot snap = current.get();
        if (snap == null) return Optional.empty();

        Duration age = Duration.between(snap.getRefreshedAt(), clock.instant());
        if (age.isNegative()) age = Duration.ZERO;

        return Optional.of(new SnapshotView(snap, age, properties.getCache().getTtl()));
    }

    public boolean isReady() {
        return current.get() != null;
    }
}
