package com.stock.monitor.backend.snapshot.service;

import com.stock.monitor.backend.snapshot.vo.HealthStatus;
import com.stock.monitor.backend.snapshot.vo.SnapshotView;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 캐시 상태 관찰 전용. 리프레시를 트리거하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class HealthReporter {

    private final SnapshotCacheStore snapshotCacheStore;
    private final SnapshotRefreshService snapshotRefreshService;

    public HealthStatus getHealth() {
        Optional<SnapshotView> view = snapshotCacheStore.currentSnapshot();

        return HealthStatus.builder()
                .cacheReady(view.isPresent())
                .ageSeconds(view.map(SnapshotView::ageSeconds).orElse(null))
                .partialFailureCount(view.map(v -> v.getSnapshot().getPartialFailureCount()).orElse(0))
                .stale(view.map(SnapshotView::isStale).orElse(false))
                .refreshInFlight(snapshotRefreshService.isRefreshing())
                .lastCycleError(snapshotRefreshService.getLastCycleError())
                .build();
    }
}
