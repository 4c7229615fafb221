package com.stock.monitor.backend.snapshot.vo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 커밋 단위의 불변 스냅샷. 한 사이클의 결과물 전체.
 */
@Value
@Builder(toBuilder = true)
public class MarketSnapshot {
    String snapshotId;
    Instant refreshedAt;

    // 워치리스트 순서 유지. ABSENT 마커 포함
    Map<String, QuoteResult> quotes;
    Map<String, IndexRecord> indices;
    List<SectorAggregate> sectors;
    MoversList movers;
    List<NewsItemVO> news;
    EarningsCalendar earnings;

    int partialFailureCount;

    public Map<String, QuoteRecord> presentQuotes() {
        Map<String, QuoteRecord> out = new LinkedHashMap<>();
        quotes.forEach((symbol, result) -> {
            if (result.isPresent()) out.put(symbol, result.getRecord());
        });
        return out;
    }

    public Map<String, AbsentReason> absentSymbols() {
        Map<String, AbsentReason> out = new LinkedHashMap<>();
        quotes.forEach((symbol, result) -> {
            if (!result.isPresent()) out.put(symbol, result.getReason());
        });
        return out;
    }
}
