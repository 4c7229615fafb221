package com.stock.monitor.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorEnvLogRunner implements CommandLineRunner {

    private final MonitorProperties properties;

    @Value("${finnhub.api-key:}")
    private String finnhubApiKey;

    @Value("${notion.database-id:}")
    private String notionDatabaseId;

    @Override
    public void run(String... args) {
        MonitorProperties.Fetch fetch = properties.getFetch();
        log.info("[MONITOR] watchlist.provider={} activeStatuses={} configuredEntries={}",
                properties.getWatchlist().getProvider(),
                properties.getWatchlist().getActiveStatuses(),
                properties.getWatchlist().getEntries().size());
        log.info("[MONITOR] cache.ttl={} fetch.maxWorkers={} maxRetries={} callTimeout={} cycleDeadline={}",
                properties.getCache().getTtl(), fetch.getMaxWorkers(), fetch.getMaxRetries(),
                fetch.getCallTimeout(), fetch.getCycleDeadline());
        log.info("[MONITOR] indices={} alwaysOpenSuffixes={}",
                properties.getIndices().size(), properties.getAlwaysOpenSuffixes());
        // 키 값은 남기지 않고 설정 여부만
        log.info("[MONITOR] finnhub.api-key set={} notion.database-id set={}",
                !finnhubApiKey.isBlank(), !notionDatabaseId.isBlank());
    }
}
