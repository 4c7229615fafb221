package com.stock.monitor.backend.market.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.monitor.backend.exception.UpstreamErrorType;
import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.dto.CalendarDates;
import com.stock.monitor.backend.market.dto.UpstreamQuote;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Slf4j
@Component
@RequiredArgsConstructor
public class YahooFinanceClient implements MarketDataClient {

    private static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${yahoo.base-url:https://query1.finance.yahoo.com}")
    private String baseUrl;

    @Override
    public UpstreamQuote fetchQuote(String symbol) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .path("/v7/finance/quote")
                .queryParam("symbols", symbol)
                .encode()
                .build()
                .toUri();

        JsonNode results = get("fetchQuote", symbol, uri).path("quoteResponse").path("result");
        if (!results.isArray() || results.isEmpty()) {
            throw new UpstreamException(UpstreamErrorType.NOT_FOUND, symbol, "quote result empty. symbol=" + symbol);
        }

        JsonNode q = results.get(0);
        Double price = doubleOrNull(q, "regularMarketPrice");
        if (price == null) {
            throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol, "regularMarketPrice missing. symbol=" + symbol);
        }

        return UpstreamQuote.builder()
                .symbol(symbol)
                .shortName(textOrNull(q, "shortName"))
                .price(price)
                .previousClose(doubleOrNull(q, "regularMarketPreviousClose"))
                .open(doubleOrNull(q, "regularMarketOpen"))
                .dayHigh(doubleOrNull(q, "regularMarketDayHigh"))
                .dayLow(doubleOrNull(q, "regularMarketDayLow"))
                .volume(longOrNull(q, "regularMarketVolume"))
                .avgVolume(longOrNull(q, "averageDailyVolume3Month"))
                .marketCap(longOrNull(q, "marketCap"))
                .preMarketPrice(doubleOrNull(q, "preMarketPrice"))
                .postMarketPrice(doubleOrNull(q, "postMarketPrice"))
                .build();
    }

    @Override
    public List<Double> fetchHistory(String symbol, int days) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .pathSegment("v8", "finance", "chart", symbol)
                .queryParam("range", "1mo")
                .queryParam("interval", "1d")
                .encode()
                .build()
                .toUri();

        JsonNode chart = get("fetchHistory", symbol, uri).path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new UpstreamException(classifyErrorText(error.toString()), symbol,
                    "chart error. symbol=" + symbol + " error=" + prefix(error.toString(), 200));
        }

        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol, "chart result empty. symbol=" + symbol);
        }

        JsonNode closeNode = result.get(0).path("indicators").path("quote").path(0).path("close");
        if (!closeNode.isArray()) {
            throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol, "chart closes missing. symbol=" + symbol);
        }

        List<Double> closes = new ArrayList<>();
        for (JsonNode c : closeNode) {
            if (c.isNumber()) closes.add(c.asDouble());
        }

        int from = Math.max(0, closes.size() - Math.max(0, days));
        return List.copyOf(closes.subList(from, closes.size()));
    }

    @Override
    public CalendarDates fetchCalendar(String symbol) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .pathSegment("v10", "finance", "quoteSummary", symbol)
                .queryParam("modules", "calendarEvents")
                .encode()
                .build()
                .toUri();

        JsonNode result = get("fetchCalendar", symbol, uri).path("quoteSummary").path("result");
        if (!result.isArray() || result.isEmpty()) {
            return CalendarDates.none();
        }

        JsonNode events = result.get(0).path("calendarEvents");
        LocalDate earnings = epochToDate(events.path("earnings").path("earningsDate").path(0).path("raw"));
        LocalDate exDividend = epochToDate(events.path("exDividendDate").path("raw"));

        return new CalendarDates(earnings, exDividend);
    }

    private JsonNode get(String call, String symbol, URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(MediaType.parseMediaTypes("application/json"));
        HttpEntity<Void> entity = new HttpEntity<>(headers);

        String body;
        try {
            ResponseEntity<String> resp = restTemplate.exchange(uri, HttpMethod.GET, entity, String.class);
            body = resp.getBody();

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String respBody = e.getResponseBodyAsString();
            log.debug("yahoo {} httpError symbol={} status={} bodyPrefix={}",
                    call, symbol, status, prefix(respBody, 200));
            throw new UpstreamException(classifyStatus(status, respBody), symbol,
                    "yahoo " + call + " http " + status + " symbol=" + symbol, e);

        } catch (ResourceAccessException e) {
            UpstreamErrorType type = (e.getCause() instanceof SocketTimeoutException)
                    ? UpstreamErrorType.TIMEOUT
                    : UpstreamErrorType.UNAVAILABLE;
            throw new UpstreamException(type, symbol, "yahoo " + call + " io failure symbol=" + symbol, e);

        } catch (RestClientException e) {
            throw new UpstreamException(UpstreamErrorType.UNAVAILABLE, symbol,
                    "yahoo " + call + " failed symbol=" + symbol, e);
        }

        if (!StringUtils.hasText(body)) {
            throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol, "yahoo " + call + " empty body symbol=" + symbol);
        }

        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("yahoo {} parseFail symbol={} bodyPrefix={}", call, symbol, prefix(body, 200));
            throw new UpstreamException(UpstreamErrorType.MALFORMED, symbol,
                    "yahoo " + call + " unparseable body symbol=" + symbol, e);
        }
    }

    static UpstreamErrorType classifyStatus(int status, String body) {
        if (status == 429) return UpstreamErrorType.RATE_LIMITED;
        if (status == 404) return UpstreamErrorType.NOT_FOUND;
        if (status == 408 || status == 504) return UpstreamErrorType.TIMEOUT;
        if (StringUtils.hasText(body) && body.toLowerCase().contains("too many requests")) {
            return UpstreamErrorType.RATE_LIMITED;
        }
        return UpstreamErrorType.UNAVAILABLE;
    }

    private static UpstreamErrorType classifyErrorText(String text) {
        String t = text.toLowerCase();
        if (t.contains("not found") || t.contains("delisted")) return UpstreamErrorType.NOT_FOUND;
        if (t.contains("too many requests") || t.contains("rate limit")) return UpstreamErrorType.RATE_LIMITED;
        return UpstreamErrorType.MALFORMED;
    }

    private static LocalDate epochToDate(JsonNode raw) {
        if (raw == null || !raw.isNumber()) return null;
        return Instant.ofEpochSecond(raw.asLong()).atZone(EXCHANGE_ZONE).toLocalDate();
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) return null;
        return v.asDouble();
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) return null;
        return v.asLong();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return StringUtils.hasText(s) ? s : null;
    }

    private static String prefix(String s, int max) {
        if (!StringUtils.hasText(s)) return "null";
        String trimmed = s.trim();
        if (trimmed.length() <= max) return trimmed;
        return trimmed.substring(0, max) + "...";
    }
}
