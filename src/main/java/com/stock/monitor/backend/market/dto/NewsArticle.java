package com.stock.monitor.backend.market.dto;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NewsArticle {
    String title;
    String source;
    Instant publishedAt;
    String url;
    String summary;
}
