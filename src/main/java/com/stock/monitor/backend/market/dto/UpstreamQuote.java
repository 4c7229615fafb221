package com.stock.monitor.backend.market.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 시세 API 원본 값. 응답에 없던 필드는 null.
 */
@Value
@Builder(toBuilder = true)
public class UpstreamQuote {
    String symbol;
    String shortName;
    Double price;
    Double previousClose;
    Double open;
    Double dayHigh;
    Double dayLow;
    Long volume;
    Long avgVolume;
    Long marketCap;
    Double preMarketPrice;
    Double postMarketPrice;
}
