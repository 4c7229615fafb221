package com.stock.monitor.backend.snapshot.analytics;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.market.dto.NewsArticle;
import com.stock.monitor.backend.snapshot.vo.DividendEvent;
import com.stock.monitor.backend.snapshot.vo.EarningsCalendar;
import com.stock.monitor.backend.snapshot.vo.EarningsEvent;
import com.stock.monitor.backend.snapshot.vo.IndexKind;
import com.stock.monitor.backend.snapshot.vo.IndexRecord;
import com.stock.monitor.backend.snapshot.vo.MarketSnapshot;
import com.stock.monitor.backend.snapshot.vo.MoversList;
import com.stock.monitor.backend.snapshot.vo.NewsItemVO;
import com.stock.monitor.backend.snapshot.vo.QuoteRecord;
import com.stock.monitor.backend.snapshot.vo.QuoteResult;
import com.stock.monitor.backend.snapshot.vo.RawSnapshot;
import com.stock.monitor.backend.snapshot.vo.SectorAggregate;
import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import com.stock.monitor.backend.watchlist.WatchlistEntry;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * RawSnapshot → MarketSnapshot 순수 변환. 네트워크/캐시/시계에 의존하지 않는다
 * (기준 시각은 호출자가 넘긴다).
 * - ABSENT 레코드와 등락률 null 레코드는 섹터/무버 계산에서 제외 (0으로 취급 금지)
 */
@Component
@RequiredArgsConstructor
public class AnalyticsEngine {

    private final MonitorProperties properties;

    public MarketSnapshot build(RawSnapshot raw, Instant refreshedAt) {
        MonitorProperties.Analytics cfg = properties.getAnalytics();
        LocalDate today = refreshedAt.atZone(ZoneId.of(properties.getSchedule().getZone())).toLocalDate();

        Collection<QuoteResult> quoteResults = raw.getQuotes().values();

        return MarketSnapshot.builder()
                .snapshotId(String.valueOf(refreshedAt.toEpochMilli()))
                .refreshedAt(refreshedAt)
                .quotes(raw.getQuotes())
                .indices(buildIndices(raw.getIndices(), properties.getIndices()))
                .sectors(aggregateSectors(quoteResults))
                .movers(rankMovers(quoteResults, cfg.getMoversTopN()))
                .news(dedupeNews(raw.getNews(), raw.getWatchlist(), cfg.getNewsLimit()))
                .earnings(buildCalendar(quoteResults, today, cfg.getEarningsDaysAhead(), cfg.getDividendDaysAhead()))
                .partialFailureCount((int) raw.failureCount())
                .build();
    }

    /**
     * 섹터별 평균 등락률.
     * 정렬: 평균 내림차순 → 종목 수 내림차순 → 섹터명 오름차순
     */
    public List<SectorAggregate> aggregateSectors(Collection<QuoteResult> results) {
        Map<String, List<QuoteRecord>> bySector = new LinkedHashMap<>();
        for (QuoteRecord r : presentRecords(results)) {
            if (r.getKind() != SymbolKind.EQUITY) continue;
            if (r.getSector() == null || r.getChangePercent() == null) continue;
            bySector.computeIfAbsent(r.getSector(), k -> new ArrayList<>()).add(r);
        }

        return bySector.entrySet().stream()
                .map(e -> {
                    List<QuoteRecord> members = e.getValue();
                    double sum = 0;
                    for (QuoteRecord m : members) sum += m.getChangePercent();
                    return SectorAggregate.builder()
                            .sector(e.getKey())
                            .averageChangePercent(sum / members.size())
                            .count(members.size())
                            .symbols(members.stream().map(QuoteRecord::getSymbol).toList())
                            .build();
                })
                .sorted(Comparator.comparingDouble(SectorAggregate::getAverageChangePercent).reversed()
                        .thenComparing(Comparator.comparingInt(SectorAggregate::getCount).reversed())
                        .thenComparing(SectorAggregate::getSector))
                .toList();
    }

    /**
     * 상승 상위 N (등락률 > 0, 내림차순) / 하락 상위 N (등락률 < 0, 오름차순).
     * 동률은 심볼 오름차순.
     */
    public MoversList rankMovers(Collection<QuoteResult> results, int topN) {
        List<QuoteRecord> ranked = presentRecords(results).stream()
                .filter(r -> r.getChangePercent() != null)
                .toList();

        List<QuoteRecord> gainers = ranked.stream()
                .filter(r -> r.getChangePercent() > 0)
                .sorted(Comparator.comparingDouble(QuoteRecord::getChangePercent).reversed()
                        .thenComparing(QuoteRecord::getSymbol))
                .limit(topN)
                .toList();

        List<QuoteRecord> losers = ranked.stream()
                .filter(r -> r.getChangePercent() < 0)
                .sorted(Comparator.comparingDouble(QuoteRecord::getChangePercent)
                        .thenComparing(QuoteRecord::getSymbol))
                .limit(topN)
                .toList();

        return MoversList.builder()
                .gainers(gainers)
                .losers(losers)
                .build();
    }

    /**
     * (title, source) 기준 중복 제거: 먼저 나온 항목 유지.
     * 제목에 워치리스트 심볼(단어 단위) 또는 회사명이 있으면 relatedSymbol 태깅.
     * 최신순 정렬 후 limit.
     */
    public List<NewsItemVO> dedupeNews(List<NewsArticle> articles, List<WatchlistEntry> watchlist, int limit) {
        if (articles == null || articles.isEmpty()) return List.of();

        List<SymbolMatcher> matchers = (watchlist == null ? List.<WatchlistEntry>of() : watchlist).stream()
                .map(SymbolMatcher::of)
                .filter(Objects::nonNull)
                .toList();

        Set<String> seen = new HashSet<>();
        List<NewsItemVO> out = new ArrayList<>();
        for (NewsArticle a : articles) {
            if (a == null || a.getTitle() == null || a.getTitle().isBlank()) continue;
            String key = a.getTitle().trim() + "\u0000" + (a.getSource() == null ? "" : a.getSource().trim());
            if (!seen.add(key)) continue;

            out.add(NewsItemVO.builder()
                    .title(a.getTitle())
                    .source(a.getSource())
                    .publishedAt(a.getPublishedAt())
                    .url(a.getUrl())
                    .summary(a.getSummary())
                    .relatedSymbol(tag(a.getTitle(), matchers))
                    .build());
        }

        return out.stream()
                .sorted(Comparator.comparing(NewsItemVO::getPublishedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(limit)
                .toList();
    }

    /**
     * 실적 발표: [today, today+earningsDays] 날짜별 그룹 (날짜 오름차순, 날짜 내 심볼 오름차순)
     * 배당락: [today, today+dividendDays] 날짜 → 심볼 순
     */
    public EarningsCalendar buildCalendar(Collection<QuoteResult> results,
                                         LocalDate today,
                                         int earningsDays,
                                         int dividendDays) {
        LocalDate earningsEnd = today.plusDays(earningsDays);
        LocalDate dividendEnd = today.plusDays(dividendDays);

        Map<LocalDate, List<EarningsEvent>> byDate = new TreeMap<>();
        List<DividendEvent> dividends = new ArrayList<>();

        for (QuoteRecord r : presentRecords(results)) {
            LocalDate earnings = r.getNextEarningsDate();
            if (earnings != null && !earnings.isBefore(today) && !earnings.isAfter(earningsEnd)) {
                byDate.computeIfAbsent(earnings, d -> new ArrayList<>())
                        .add(new EarningsEvent(r.getSymbol(), r.getName(), earnings));
            }

            LocalDate exDate = r.getNextExDividendDate();
            if (exDate != null && !exDate.isBefore(today) && !exDate.isAfter(dividendEnd)) {
                dividends.add(new DividendEvent(r.getSymbol(), r.getName(), exDate));
            }
        }

        Map<LocalDate, List<EarningsEvent>> grouped = new LinkedHashMap<>();
        byDate.forEach((date, events) -> grouped.put(date, events.stream()
                .sorted(Comparator.comparing(EarningsEvent::symbol))
                .toList()));

        dividends.sort(Comparator.comparing(DividendEvent::exDate).thenComparing(DividendEvent::symbol));

        return EarningsCalendar.builder()
                .byDate(Collections.unmodifiableMap(grouped))
                .dividends(List.copyOf(dividends))
                .build();
    }

    /**
     * 지수/선물. ABSENT 지수는 맵에서 빠진다 (실패 건수는 partialFailureCount에 반영).
     */
    public Map<String, IndexRecord> buildIndices(Map<String, QuoteResult> results,
                                                 List<MonitorProperties.IndexSpec> specs) {
        Map<String, IndexRecord> out = new LinkedHashMap<>();
        if (results == null) return out;

        for (MonitorProperties.IndexSpec spec : specs) {
            QuoteResult result = results.get(spec.getSymbol());
            if (result == null || !result.isPresent()) continue;

            QuoteRecord r = result.getRecord();
            out.put(spec.getSymbol(), IndexRecord.builder()
                    .symbol(spec.getSymbol())
                    .name(spec.getName() != null ? spec.getName() : r.getName())
                    .kind(spec.getKind())
                    .level(r.getPrice())
                    .change(r.getChange())
                    .changePercent(r.getChangePercent())
                    .dailyCloses(r.getDailyCloses())
                    .weekChangePercent(r.getWeekChangePercent())
                    .formattedLevel(IndexFormatter.formatLevel(r.getPrice()))
                    .formattedChange(IndexFormatter.formatChange(r.getChange(), r.getChangePercent()))
                    .tradable(spec.getKind() != IndexKind.VOLATILITY)
                    .build());
        }
        return Collections.unmodifiableMap(out);
    }

    private static List<QuoteRecord> presentRecords(Collection<QuoteResult> results) {
        if (results == null) return List.of();
        return results.stream()
                .filter(Objects::nonNull)
                .filter(QuoteResult::isPresent)
                .map(QuoteResult::getRecord)
                .toList();
    }

    private static String tag(String title, List<SymbolMatcher> matchers) {
        for (SymbolMatcher m : matchers) {
            if (m.matches(title)) return m.symbol;
        }
        return null;
    }

    private static final class SymbolMatcher {
        private final String symbol;
        private final Pattern tickerPattern;
        private final String companyLower;

        private SymbolMatcher(String symbol, Pattern tickerPattern, String companyLower) {
            this.symbol = symbol;
            this.tickerPattern = tickerPattern;
            this.companyLower = companyLower;
        }

        static SymbolMatcher of(WatchlistEntry e) {
            if (e == null || e.getSymbol() == null || e.getSymbol().isBlank()) return null;
            String symbol = e.getSymbol();
            // 한 글자 티커는 일반 단어와 구분이 안 돼서 회사명으로만 매칭
            Pattern ticker = symbol.length() >= 2
                    ? Pattern.compile("(?<![A-Za-z0-9])" + Pattern.quote(symbol) + "(?![A-Za-z0-9])")
                    : null;
            String company = (e.getCompanyName() == null || e.getCompanyName().isBlank())
                    ? null
                    : e.getCompanyName().trim().toLowerCase();
            return new SymbolMatcher(symbol, ticker, company);
        }

        boolean matches(String title) {
            if (tickerPattern != null && tickerPattern.matcher(title).find()) return true;
            return companyLower != null && title.toLowerCase().contains(companyLower);
        }
    }
}
