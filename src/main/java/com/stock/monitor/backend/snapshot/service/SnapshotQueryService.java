package com.stock.monitor.backend.snapshot.service;

import com.stock.monitor.backend.exception.SnapshotNotReadyException;
import com.stock.monitor.backend.exception.SymbolNotTrackedException;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.SnapshotView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 리포트/대시보드가 읽는 입구. 캐시가 비어 있으면 빈 데이터 대신 NotReady.
 */
@Service
@RequiredArgsConstructor
public class SnapshotQueryService {

    private final SnapshotCacheStore snapshotCacheStore;

    public SnapshotView getSnapshot() {
        return snapshotCacheStore.currentSnapshot()
                .orElseThrow(SnapshotNotReadyException::new);
    }

    public QuoteResult getQuote(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        String key = symbol.trim().toUpperCase();
        QuoteResult result = getSnapshot().getSnapshot().getQuotes().get(key);
        if (result == null) {
            throw new SymbolNotTrackedException(key);
        }
        return result;
    }
}
