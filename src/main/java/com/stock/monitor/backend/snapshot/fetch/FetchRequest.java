package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.snapshot.vo.SymbolKind;

/**
 * 워커 1개가 처리하는 작업 단위 = 심볼 1개.
 */
public record FetchRequest(String symbol, SymbolKind kind, boolean includeCalendar, String displayName, String sector) {
}
