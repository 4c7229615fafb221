package com.stock.monitor.backend.snapshot.vo;

import java.time.Duration;
import lombok.Value;

/**
 * 읽기 시점의 스냅샷 + 나이. TTL은 참고용이며 캐시가 직접 만료시키지 않는다.
 */
@Value
public class SnapshotView {
    MarketSnapshot snapshot;
    Duration age;
    Duration ttl;

    public long ageSeconds() {
        return age.getSeconds();
    }

    public boolean isStale() {
        return age.compareTo(ttl) > 0;
    }
}
