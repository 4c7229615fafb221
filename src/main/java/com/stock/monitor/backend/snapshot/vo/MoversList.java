package com.stock.monitor.backend.snapshot.vo;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MoversList {
    // 등락률 내림차순
    List<QuoteRecord> gainers;
    // 등락률 오름차순
    List<QuoteRecord> losers;
}
