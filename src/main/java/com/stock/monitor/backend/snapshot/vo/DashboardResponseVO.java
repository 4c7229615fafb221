package com.stock.monitor.backend.snapshot.vo;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * /api/all 응답. 한 번의 커밋에서 나온 뷰만 담는다.
 */
@Value
@Builder
public class DashboardResponseVO {
    String snapshotId;
    Instant refreshedAt;
    long ageSeconds;
    boolean stale;
    int partialFailureCount;

    Map<String, QuoteRecord> quotes;
    Map<String, AbsentReason> absentSymbols;
    List<SectorAggregate> sectors;
    MoversList movers;
    Map<String, IndexRecord> indices;
    List<NewsItemVO> news;
    EarningsCalendar earnings;

    public static DashboardResponseVO from(SnapshotView view) {
        MarketSnapshot s = view.getSnapshot();
        return DashboardResponseVO.builder()
                .snapshotId(s.getSnapshotId())
                .refreshedAt(s.getRefreshedAt())
                .ageSeconds(view.ageSeconds())
                .stale(view.isStale())
                .partialFailureCount(s.getPartialFailureCount())
                .quotes(s.presentQuotes())
                .absentSymbols(s.absentSymbols())
                .sectors(s.getSectors())
                .movers(s.getMovers())
                .indices(s.getIndices())
                .news(s.getNews())
                .earnings(s.getEarnings())
                .build();
    }
}
