package com.stock.monitor.backend.snapshot.vo;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NewsItemVO {
    String title;
    String source;
    Instant publishedAt;
    String url;
    String summary;
    String relatedSymbol; // 제목에 워치리스트 심볼이 있으면 태깅
}
