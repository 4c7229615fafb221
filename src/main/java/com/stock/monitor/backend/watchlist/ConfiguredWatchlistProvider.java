package com.stock.monitor.backend.watchlist;

import com.stock.monitor.backend.config.MonitorProperties;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitor.watchlist.provider", havingValue = "config", matchIfMissing = true)
public class ConfiguredWatchlistProvider implements WatchlistProvider {

    private final MonitorProperties properties;

    @Override
    public List<WatchlistEntry> listWatchlist(List<String> statuses) {
        return toEntries(properties.getWatchlist().getEntries()).stream()
                .filter(e -> statuses == null || statuses.isEmpty() || statuses.contains(e.getStatus()))
                .toList();
    }

    @Override
    public String name() {
        return "config";
    }

    static List<WatchlistEntry> toEntries(List<MonitorProperties.Entry> entries) {
        if (entries == null) return List.of();
        return entries.stream()
                .filter(Objects::nonNull)
                .filter(e -> !WatchlistEntry.normalizeSymbol(e.getSymbol()).isEmpty())
                .map(e -> WatchlistEntry.builder()
                        .symbol(WatchlistEntry.normalizeSymbol(e.getSymbol()))
                        .companyName(WatchlistEntry.blankToNull(e.getName()))
                        .sector(WatchlistEntry.blankToNull(e.getSector()))
                        .sentiment(WatchlistEntry.blankToNull(e.getSentiment()))
                        .thesis(WatchlistEntry.blankToNull(e.getThesis()))
                        .catalysts(WatchlistEntry.blankToNull(e.getCatalysts()))
                        .status(e.getStatus())
                        .build())
                .toList();
    }
}
