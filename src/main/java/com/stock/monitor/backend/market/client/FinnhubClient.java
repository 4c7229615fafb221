package com.stock.monitor.backend.market.client;

import com.stock.monitor.backend.exception.UpstreamErrorType;
import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.dto.FinnhubNewsItemDTO;
import com.stock.monitor.backend.market.dto.NewsArticle;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class FinnhubClient implements NewsClient {

    private final RestTemplate restTemplate;

    @Value("${finnhub.base-url:https://finnhub.io/api/v1}")
    private String baseUrl;

    @Value("${finnhub.api-key:}")
    private String apiKey;

    @Value("${finnhub.news-category:general}")
    private String newsCategory;

    @Override
    public List<NewsArticle> fetchMarketNews() {
        return getMarketNews(newsCategory).stream()
                .filter(Objects::nonNull)
                .filter(n -> StringUtils.hasText(n.getHeadline()))
                .map(n -> NewsArticle.builder()
                        .title(n.getHeadline().trim())
                        .source(n.getSource())
                        .publishedAt(Instant.ofEpochSecond(n.getDatetime()))
                        .url(n.getUrl())
                        .summary(n.getSummary())
                        .build())
                .toList();
    }

    public List<FinnhubNewsItemDTO> getMarketNews(String category) {
        if (!StringUtils.hasText(apiKey)) {
            throw new UpstreamException(UpstreamErrorType.UNAVAILABLE, null, "finnhub.api-key 가 설정되지 않았습니다.");
        }

        String url = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .path("/news")
                .queryParam("category", category)
                .build()
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Finnhub-Token", apiKey);
        HttpEntity<Void> entity = new HttpEntity<>(headers);

        ResponseEntity<FinnhubNewsItemDTO[]> res;
        try {
            res = restTemplate.exchange(url, HttpMethod.GET, entity, FinnhubNewsItemDTO[].class);
        } catch (RestClientException e) {
            throw new UpstreamException(UpstreamErrorType.UNAVAILABLE, null,
                    "Finnhub market news fetch failed: " + category, e);
        }

        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new UpstreamException(UpstreamErrorType.MALFORMED, null,
                    "Finnhub market news fetch failed: " + category);
        }

        return Arrays.asList(res.getBody());
    }
}
