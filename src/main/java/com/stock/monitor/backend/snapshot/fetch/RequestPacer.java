package com.stock.monitor.backend.snapshot.fetch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * 사이클 1회 동안 공유되는 호출 간격 조절기.
 * - 매 호출 전 jitter 만큼 대기
 * - RATE_LIMITED 응답마다 추가 간격을 step 만큼 늘림 (상한 maxSpacing)
 */
@Slf4j
public class RequestPacer {

    private final long jitterMinMs;
    private final long jitterMaxMs;
    private final long stepMs;
    private final long maxSpacingMs;

    private final AtomicLong extraSpacingMs = new AtomicLong();

    public RequestPacer(Duration jitterMin, Duration jitterMax, Duration step, Duration maxSpacing) {
        this.jitterMinMs = Math.max(0, jitterMin.toMillis());
        this.jitterMaxMs = Math.max(this.jitterMinMs, jitterMax.toMillis());
        this.stepMs = Math.max(0, step.toMillis());
        this.maxSpacingMs = Math.max(0, maxSpacing.toMillis());
    }

    public static RequestPacer none() {
        return new RequestPacer(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    public void pause() throws InterruptedException {
        long jitter = (jitterMaxMs > jitterMinMs)
                ? ThreadLocalRandom.current().nextLong(jitterMinMs, jitterMaxMs + 1)
                : jitterMinMs;
        long wait = jitter + extraSpacingMs.get();
        if (wait > 0) Thread.sleep(wait);
    }

    public void onRateLimited() {
        long next = extraSpacingMs.updateAndGet(cur -> Math.min(maxSpacingMs, cur + stepMs));
        log.info("Upstream rate limited. spacing raised to {}ms", next);
    }

    public long currentExtraSpacingMs() {
        return extraSpacingMs.get();
    }
}
