package com.stock.monitor.backend.support;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.market.dto.UpstreamQuote;
import com.stock.monitor.backend.snapshot.vo.QuoteRecord;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import com.stock.monitor.backend.watchlist.WatchlistEntry;
import java.time.Duration;
import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    // 대기/재시도 간격을 모두 0으로: 테스트가 sleep 하지 않도록
    public static MonitorProperties fastProperties() {
        MonitorProperties p = new MonitorProperties();
        MonitorProperties.Fetch f = p.getFetch();
        f.setMaxWorkers(4);
        f.setMaxRetries(2);
        f.setRetryBackoff(Duration.ZERO);
        f.setJitterMin(Duration.ZERO);
        f.setJitterMax(Duration.ZERO);
        f.setRateLimitStep(Duration.ZERO);
        f.setRateLimitMaxSpacing(Duration.ZERO);
        f.setCycleDeadline(Duration.ofSeconds(10));
        p.setIndices(List.of());
        return p;
    }

    public static WatchlistEntry entry(String symbol, String sector) {
        return WatchlistEntry.builder()
                .symbol(symbol)
                .companyName(symbol + " Corp")
                .sector(sector)
                .status("Watching")
                .build();
    }

    public static UpstreamQuote quote(String symbol, double price, double previousClose) {
        return UpstreamQuote.builder()
                .symbol(symbol)
                .shortName(symbol + " Inc")
                .price(price)
                .previousClose(previousClose)
                .volume(1_000L)
                .avgVolume(500L)
                .build();
    }

    public static QuoteResult present(String symbol, String sector, Double changePercent) {
        return QuoteResult.present(QuoteRecord.builder()
                .symbol(symbol)
                .name(symbol)
                .kind(SymbolKind.EQUITY)
                .sector(sector)
                .price(100.0)
                .changePercent(changePercent)
                .dailyCloses(List.of())
                .build());
    }
}
