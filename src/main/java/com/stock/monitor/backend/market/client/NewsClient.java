package com.stock.monitor.backend.market.client;

import com.stock.monitor.backend.market.dto.NewsArticle;
import java.util.List;

public interface NewsClient {

    List<NewsArticle> fetchMarketNews();
}
