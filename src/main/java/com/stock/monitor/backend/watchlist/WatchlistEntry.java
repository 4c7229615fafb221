package com.stock.monitor.backend.watchlist;

import lombok.Builder;
import lombok.Value;

/**
 * 워치리스트 1행. 코어는 읽기만 한다.
 */
@Value
@Builder
public class WatchlistEntry {
    String symbol;
    String companyName;
    String sector;      // 없으면 null (섹터 집계에서 제외)
    String sentiment;
    String thesis;
    String catalysts;
    String status;

    public static String normalizeSymbol(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase();
    }

    public static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
