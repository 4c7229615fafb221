package com.stock.monitor.backend.market.client;

import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.dto.CalendarDates;
import com.stock.monitor.backend.market.dto.UpstreamQuote;
import java.util.List;

/**
 * 심볼 단위 시세 조회. 각 호출은 독립적으로 실패할 수 있다.
 * 실패는 모두 {@link UpstreamException}으로 올라온다.
 */
public interface MarketDataClient {

    UpstreamQuote fetchQuote(String symbol);

    /**
     * 최근 일봉 종가, 오래된 것부터. 최대 days개.
     */
    List<Double> fetchHistory(String symbol, int days);

    CalendarDates fetchCalendar(String symbol);
}
