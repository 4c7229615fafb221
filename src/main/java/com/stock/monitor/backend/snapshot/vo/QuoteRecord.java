package com.stock.monitor.backend.snapshot.vo;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 한 사이클에서 수집한 종목 1개의 시세.
 * - 값이 없으면 0이 아니라 null (등락률 null 종목은 무버 랭킹에서 제외)
 * - dailyCloses: 비어 있거나 2개 이상 (오래된 → 최신)
 */
@Value
@Builder
public class QuoteRecord {

    String symbol;
    String name;
    SymbolKind kind;
    String sector;

    Double price;
    Double change;
    Double changePercent;
    Double open;
    Double dayHigh;
    Double dayLow;
    Double previousClose;

    Long volume;
    Long avgVolume;
    Double volumeRatio;
    Long marketCap;

    List<Double> dailyCloses;
    Double weekChangePercent;

    // EQUITY 전용
    Double preMarketPrice;
    Double preMarketChangePercent;
    Double postMarketPrice;
    Double postMarketChangePercent;

    LocalDate nextEarningsDate;
    LocalDate nextExDividendDate;

    public static Double changeOf(Double price, Double previousClose) {
        if (price == null || previousClose == null || previousClose <= 0) return null;
        return price - previousClose;
    }

    public static Double changePercentOf(Double price, Double previousClose) {
        if (price == null || previousClose == null || previousClose <= 0) return null;
        return (price - previousClose) / previousClose * 100;
    }

    public static class QuoteRecordBuilder {

        // 트렌드 라인은 점 2개 이상일 때만 의미가 있다
        public QuoteRecordBuilder dailyCloses(List<Double> closes) {
            this.dailyCloses = (closes == null || closes.size() < 2) ? List.of() : List.copyOf(closes);
            return this;
        }
    }
}
