package com.stock.monitor.backend.snapshot.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthStatus {
    boolean cacheReady;
    Long ageSeconds;          // 스냅샷이 없으면 null
    int partialFailureCount;
    boolean refreshInFlight;
    boolean stale;
    String lastCycleError;
}
