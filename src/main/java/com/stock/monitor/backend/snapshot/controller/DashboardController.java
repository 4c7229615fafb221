package com.stock.monitor.backend.snapshot.controller;

import com.stock.monitor.backend.snapshot.service.HealthReporter;
import com.stock.monitor.backend.snapshot.service.SnapshotQueryService;
import com.stock.monitor.backend.snapshot.service.SnapshotRefreshService;
import com.stock.monitor.backend.snapshot.vo.DashboardResponseVO;
import com.stock.monitor.backend.snapshot.vo.EarningsCalendar;
import com.stock.monitor.backend.snapshot.vo.HealthStatus;
import com.stock.monitor.backend.snapshot.vo.IndexRecord;
import com.stock.monitor.backend.snapshot.vo.MoversList;
import com.stock.monitor.backend.snapshot.vo.NewsItemVO;
import com.stock.monitor.backend.snapshot.vo.QuoteRecord;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.RefreshResponse;
import com.stock.monitor.backend.snapshot.vo.SectorAggregate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 캐시 기반 조회만 한다 (외부 API 호출 없음).
 * 캐시가 비어 있으면 GlobalExceptionHandler가 202 loading 응답.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {

    private final SnapshotQueryService snapshotQueryService;
    private final SnapshotRefreshService snapshotRefreshService;
    private final HealthReporter healthReporter;

    @GetMapping("/all")
    public DashboardResponseVO getAll() {
        return DashboardResponseVO.from(snapshotQueryService.getSnapshot());
    }

    @GetMapping("/quotes")
    public Map<String, QuoteRecord> getQuotes() {
        return snapshotQueryService.getSnapshot().getSnapshot().presentQuotes();
    }

    @GetMapping("/quotes/{symbol}")
    public QuoteResult getQuote(@PathVariable String symbol) {
        return snapshotQueryService.getQuote(symbol);
    }

    @GetMapping("/sectors")
    public List<SectorAggregate> getSectors() {
        return snapshotQueryService.getSnapshot().getSnapshot().getSectors();
    }

    @GetMapping("/movers")
    public MoversList getMovers() {
        return snapshotQueryService.getSnapshot().getSnapshot().getMovers();
    }

    @GetMapping("/indices")
    public Map<String, IndexRecord> getIndices() {
        return snapshotQueryService.getSnapshot().getSnapshot().getIndices();
    }

    @GetMapping("/news")
    public List<NewsItemVO> getNews() {
        return snapshotQueryService.getSnapshot().getSnapshot().getNews();
    }

    @GetMapping("/earnings")
    public EarningsCalendar getEarnings() {
        return snapshotQueryService.getSnapshot().getSnapshot().getEarnings();
    }

    @GetMapping("/health")
    public HealthStatus getHealth() {
        return healthReporter.getHealth();
    }

    @PostMapping("/refresh")
    public RefreshResponse refresh() {
        return new RefreshResponse(snapshotRefreshService.forceRefresh());
    }
}
