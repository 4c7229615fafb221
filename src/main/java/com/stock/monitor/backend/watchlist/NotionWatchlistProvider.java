package com.stock.monitor.backend.watchlist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.monitor.backend.exception.WatchlistUnavailableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Notion 데이터베이스를 워치리스트 원본으로 사용.
 * - Status(select)가 활성 상태인 페이지만 조회 (or 필터)
 * - has_more / next_cursor 로 페이지네이션
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitor.watchlist.provider", havingValue = "notion")
public class NotionWatchlistProvider implements WatchlistProvider {

    private static final int PAGE_SIZE = 100;
    private static final int MAX_ATTEMPTS = 3;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${notion.base-url:https://api.notion.com}")
    private String baseUrl;

    @Value("${notion.token:}")
    private String token;

    @Value("${notion.database-id:}")
    private String databaseId;

    @Value("${notion.version:2022-06-28}")
    private String notionVersion;

    @Value("${notion.retry-backoff-ms:1000}")
    private long retryBackoffMs;

    @Override
    public List<WatchlistEntry> listWatchlist(List<String> statuses) {
        if (!StringUtils.hasText(token) || !StringUtils.hasText(databaseId)) {
            throw new WatchlistUnavailableException("notion.token / notion.database-id 가 설정되지 않았습니다.");
        }

        String url = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .pathSegment("v1", "databases", databaseId, "query")
                .build()
                .toUriString();

        List<WatchlistEntry> out = new ArrayList<>();
        String cursor = null;
        boolean hasMore = true;

        while (hasMore) {
            JsonNode page = queryPage(url, statuses, cursor);

            for (JsonNode result : page.path("results")) {
                WatchlistEntry entry = toEntry(result.path("properties"));
                if (entry != null) out.add(entry);
            }

            hasMore = page.path("has_more").asBoolean(false);
            cursor = page.path("next_cursor").isTextual() ? page.path("next_cursor").asText() : null;
            if (cursor == null) hasMore = false;
        }

        log.info("Fetched {} tickers from Notion (statuses: {})", out.size(), statuses);
        return out;
    }

    @Override
    public String name() {
        return "notion";
    }

    private JsonNode queryPage(String url, List<String> statuses, String cursor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        List<Map<String, Object>> statusFilters = statuses.stream()
                .map(s -> Map.<String, Object>of("property", "Status", "select", Map.of("equals", s)))
                .toList();
        payload.put("filter", Map.of("or", statusFilters));
        payload.put("page_size", PAGE_SIZE);
        if (cursor != null) payload.put("start_cursor", cursor);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("Notion-Version", notionVersion);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload, headers);

        for (int attempt = 1; ; attempt++) {
            try {
                ResponseEntity<String> resp = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
                return objectMapper.readTree(resp.getBody() == null ? "{}" : resp.getBody());

            } catch (RestClientResponseException e) {
                int status = e.getStatusCode().value();
                if (status == 401) {
                    log.error("Notion token expired or invalid (401 Unauthorized). Update notion.token.");
                    throw new WatchlistUnavailableException("Notion 401 Unauthorized", e);
                }
                boolean retryable = status == 429 || status >= 500;
                if (!retryable || attempt >= MAX_ATTEMPTS) {
                    throw new WatchlistUnavailableException("Notion API error status=" + status, e);
                }
                log.warn("Notion query failed status={} attempt={}/{}", status, attempt, MAX_ATTEMPTS);

            } catch (RestClientException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new WatchlistUnavailableException("Notion API unreachable", e);
                }
                log.warn("Notion query io failure attempt={}/{} msg={}", attempt, MAX_ATTEMPTS, e.getMessage());

            } catch (IOException e) {
                throw new WatchlistUnavailableException("Notion response unparseable", e);
            }

            backoff(attempt);
        }
    }

    // 1s, 2s, 4s ...
    private void backoff(int attempt) {
        try {
            Thread.sleep(retryBackoffMs * (1L << (attempt - 1)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WatchlistUnavailableException("Notion query interrupted", e);
        }
    }

    private WatchlistEntry toEntry(JsonNode props) {
        String ticker = WatchlistEntry.normalizeSymbol(firstText(props.path("Ticker").path("title")));
        if (ticker.isEmpty()) return null;

        return WatchlistEntry.builder()
                .symbol(ticker)
                .companyName(WatchlistEntry.blankToNull(firstText(props.path("Company Name").path("rich_text"))))
                .sector(WatchlistEntry.blankToNull(selectName(props.path("Sector"))))
                .status(selectName(props.path("Status")))
                .sentiment(WatchlistEntry.blankToNull(selectName(props.path("Sentiment"))))
                .thesis(WatchlistEntry.blankToNull(firstText(props.path("Investment Thesis").path("rich_text"))))
                .catalysts(WatchlistEntry.blankToNull(firstText(props.path("Catalysts").path("rich_text"))))
                .build();
    }

    private static String firstText(JsonNode array) {
        if (!array.isArray() || array.isEmpty()) return null;
        JsonNode content = array.get(0).path("text").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private static String selectName(JsonNode prop) {
        JsonNode name = prop.path("select").path("name");
        return name.isTextual() ? name.asText() : null;
    }
}
