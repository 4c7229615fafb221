package com.stock.monitor.backend.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@RequiredArgsConstructor
public class FetchExecutorConfig {

    private final MonitorProperties properties;

    /**
     * 심볼 fetch 워커 풀. 동시 업스트림 호출 수 = max-workers.
     */
    @Bean(name = "quoteFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService quoteFetchExecutor() {
        return Executors.newFixedThreadPool(
                properties.getFetch().getMaxWorkers(),
                new CustomizableThreadFactory("quote-fetch-"));
    }

    // 수동 새로고침 / 워밍업은 요청 스레드를 막지 않도록 별도 스레드에서
    @Bean(name = "refreshTriggerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService refreshTriggerExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("refresh-trigger-"));
    }
}
