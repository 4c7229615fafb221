package com.stock.monitor.backend.snapshot.vo;

import com.stock.monitor.backend.market.dto.NewsArticle;
import com.stock.monitor.backend.watchlist.WatchlistEntry;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 한 사이클의 fan-in 결과 (가공 전).
 * - 맵 순서는 디스패치 순서(워치리스트 순서)를 따른다
 */
@Value
@Builder(toBuilder = true)
public class RawSnapshot {

    List<WatchlistEntry> watchlist;
    Map<String, QuoteResult> quotes;
    Map<String, QuoteResult> indices;
    List<NewsArticle> news;

    public long failureCount() {
        long q = quotes.values().stream().filter(r -> !r.isPresent()).count();
        long i = indices.values().stream().filter(r -> !r.isPresent()).count();
        return q + i;
    }
}
