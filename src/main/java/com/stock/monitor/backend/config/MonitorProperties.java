package com.stock.monitor.backend.config;

import com.stock.monitor.backend.snapshot.vo.IndexKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Analytics analytics = new Analytics();

    @Valid
    private Watchlist watchlist = new Watchlist();

    @Valid
    private Schedule schedule = new Schedule();

    // 24시간 거래 종목(크립토 등) 심볼 접미사
    private List<String> alwaysOpenSuffixes = new ArrayList<>(List.of("-USD"));

    private List<IndexSpec> indices = new ArrayList<>(List.of(
            new IndexSpec("^GSPC", "S&P 500", IndexKind.INDEX),
            new IndexSpec("^IXIC", "NASDAQ", IndexKind.INDEX),
            new IndexSpec("^DJI", "Dow Jones", IndexKind.INDEX),
            new IndexSpec("^VIX", "VIX", IndexKind.VOLATILITY),
            new IndexSpec("^RUT", "Russell 2000", IndexKind.INDEX),
            new IndexSpec("ES=F", "S&P 500 Futures", IndexKind.FUTURE),
            new IndexSpec("NQ=F", "NASDAQ Futures", IndexKind.FUTURE),
            new IndexSpec("YM=F", "Dow Futures", IndexKind.FUTURE),
            new IndexSpec("RTY=F", "Russell 2000 Futures", IndexKind.FUTURE)
    ));

    @Getter
    @Setter
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Fetch {
        @Min(1)
        @Max(32)
        private int maxWorkers = 8;

        @Min(0)
        @Max(5)
        private int maxRetries = 2;

        private Duration retryBackoff = Duration.ofMillis(500);
        private Duration callTimeout = Duration.ofSeconds(12);
        private Duration cycleDeadline = Duration.ofSeconds(90);

        private Duration jitterMin = Duration.ofMillis(50);
        private Duration jitterMax = Duration.ofMillis(250);

        private Duration rateLimitStep = Duration.ofMillis(500);
        private Duration rateLimitMaxSpacing = Duration.ofSeconds(5);

        @Min(2)
        private int historyDays = 7;

        private Duration notFoundRecheck = Duration.ofHours(6);
    }

    @Getter
    @Setter
    public static class Analytics {
        @Min(1)
        private int moversTopN = 5;

        @Min(0)
        private int newsLimit = 20;

        @Min(0)
        private int earningsDaysAhead = 14;

        @Min(0)
        private int dividendDaysAhead = 30;
    }

    @Getter
    @Setter
    public static class Watchlist {
        private String provider = "config";
        private List<String> activeStatuses = new ArrayList<>(List.of("Watching", "Holding"));
        private Duration lastGoodMaxAge = Duration.ofHours(24);
        private List<Entry> entries = new ArrayList<>();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Entry {
        private String symbol;
        private String name;
        private String sector;
        private String sentiment;
        private String thesis;
        private String catalysts;
        private String status = "Watching";
    }

    @Getter
    @Setter
    public static class Schedule {
        private String zone = "America/New_York";
        private String marketCron = "0 */5 4-19 * * MON-FRI";
        private String offHoursCron = "0 0 */2 * * *";
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class IndexSpec {
        private String symbol;
        private String name;
        private IndexKind kind = IndexKind.INDEX;

        public IndexSpec(String symbol, String name, IndexKind kind) {
            this.symbol = symbol;
            this.name = name;
            this.kind = kind;
        }
    }
}
