package com.stock.monitor.backend.snapshot.scheduler;

import com.stock.monitor.backend.snapshot.service.MarketCalendar;
import com.stock.monitor.backend.snapshot.service.SnapshotRefreshService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotRefreshScheduler {

    private final SnapshotRefreshService snapshotRefreshService;
    private final MarketCalendar marketCalendar;

    // 첫 사이클은 비동기로: 그동안 API는 "로딩 중"을 응답
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            boolean started = snapshotRefreshService.forceRefresh();
            log.info("Snapshot warm-up {}", started ? "started" : "skipped (already in flight)");
        } catch (Exception e) {
            log.error("Snapshot warm-up failed. server will continue.", e);
        }
    }

    // 프리마켓 ~ 애프터마켓 (뉴욕 04:00~19:55): 5분마다, 휴장일 제외
    @Scheduled(cron = "${monitor.schedule.market-cron:0 */5 4-19 * * MON-FRI}", zone = "${monitor.schedule.zone:America/New_York}")
    public void refreshDuringMarketHours() {
        if (!marketCalendar.isTradingDayToday()) {
            log.debug("Market holiday. skip market-hours refresh");
            return;
        }
        try {
            snapshotRefreshService.refreshIfIdle();
        } catch (Exception e) {
            log.warn("Snapshot refresh failed (market hours). Keep last success.", e);
        }
    }

    // 장 외 시간/주말: 24시간 종목 때문에 느린 주기로 계속 갱신
    @Scheduled(cron = "${monitor.schedule.off-hours-cron:0 0 */2 * * *}", zone = "${monitor.schedule.zone:America/New_York}")
    public void refreshOffHours() {
        try {
            snapshotRefreshService.refreshIfIdle();
        } catch (Exception e) {
            log.warn("Snapshot refresh failed (off hours). Keep last success.", e);
        }
    }
}
