package com.stock.monitor.backend.market.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.monitor.backend.exception.UpstreamErrorType;
import com.stock.monitor.backend.exception.UpstreamException;
import com.stock.monitor.backend.market.dto.CalendarDates;
import com.stock.monitor.backend.market.dto.UpstreamQuote;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class YahooFinanceClientTest {

    private static final String BASE = "https://yahoo.test";

    MockRestServiceServer server;
    YahooFinanceClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new YahooFinanceClient(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(client, "baseUrl", BASE);
    }

    @Test
    void quote_fields_are_mapped() {
        // given
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andExpect(method(org.springframework.http.HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"quoteResponse":{"result":[{
                          "symbol":"AAPL","shortName":"Apple Inc.",
                          "regularMarketPrice":190.5,"regularMarketPreviousClose":188.0,
                          "regularMarketOpen":189.0,"regularMarketDayHigh":191.2,"regularMarketDayLow":187.9,
                          "regularMarketVolume":50000000,"averageDailyVolume3Month":60000000,
                          "marketCap":2950000000000,"preMarketPrice":189.4
                        }],"error":null}}
                        """, MediaType.APPLICATION_JSON));

        // when
        UpstreamQuote q = client.fetchQuote("AAPL");

        // then
        assertEquals("Apple Inc.", q.getShortName());
        assertEquals(190.5, q.getPrice());
        assertEquals(188.0, q.getPreviousClose());
        assertEquals(50_000_000L, q.getVolume());
        assertEquals(2_950_000_000_000L, q.getMarketCap());
        assertEquals(189.4, q.getPreMarketPrice());
        assertNull(q.getPostMarketPrice());
        server.verify();
    }

    @Test
    void empty_quote_result_is_not_found() {
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andRespond(withSuccess("{\"quoteResponse\":{\"result\":[],\"error\":null}}", MediaType.APPLICATION_JSON));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchQuote("ZZZZ"));

        assertEquals(UpstreamErrorType.NOT_FOUND, e.getType());
        assertFalse(e.isRetryable());
    }

    @Test
    void quote_without_price_is_malformed() {
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andRespond(withSuccess("{\"quoteResponse\":{\"result\":[{\"symbol\":\"AAPL\"}]}}", MediaType.APPLICATION_JSON));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchQuote("AAPL"));

        assertEquals(UpstreamErrorType.MALFORMED, e.getType());
    }

    @Test
    void http_429_is_rate_limited() {
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("Too Many Requests"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchQuote("AAPL"));

        assertEquals(UpstreamErrorType.RATE_LIMITED, e.getType());
        assertTrue(e.isRetryable());
    }

    @Test
    void http_503_is_unavailable() {
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchQuote("AAPL"));

        assertEquals(UpstreamErrorType.UNAVAILABLE, e.getType());
    }

    @Test
    void non_json_body_is_malformed() {
        server.expect(requestTo(startsWith(BASE + "/v7/finance/quote")))
                .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchQuote("AAPL"));

        assertEquals(UpstreamErrorType.MALFORMED, e.getType());
    }

    @Test
    void history_drops_null_closes_and_keeps_last_days() {
        server.expect(requestTo(startsWith(BASE + "/v8/finance/chart/AAPL")))
                .andRespond(withSuccess("""
                        {"chart":{"result":[{"indicators":{"quote":[{"close":
                          [1.0, 2.0, null, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0]
                        }]}}],"error":null}}
                        """, MediaType.APPLICATION_JSON));

        List<Double> closes = client.fetchHistory("AAPL", 7);

        assertEquals(List.of(3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0), closes);
    }

    @Test
    void chart_not_found_error_is_not_found() {
        server.expect(requestTo(startsWith(BASE + "/v8/finance/chart/GONE")))
                .andRespond(withSuccess("""
                        {"chart":{"result":null,"error":{"code":"Not Found","description":"No data found, symbol may be delisted"}}}
                        """, MediaType.APPLICATION_JSON));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchHistory("GONE", 7));

        assertEquals(UpstreamErrorType.NOT_FOUND, e.getType());
    }

    @Test
    void calendar_dates_are_converted_to_exchange_dates() {
        // 1741636800 = 2025-03-10T20:00:00Z (뉴욕 16:00), 1741003200 = 2025-03-03T12:00:00Z
        server.expect(requestTo(startsWith(BASE + "/v10/finance/quoteSummary/AAPL")))
                .andRespond(withSuccess("""
                        {"quoteSummary":{"result":[{"calendarEvents":{
                          "earnings":{"earningsDate":[{"raw":1741636800,"fmt":"2025-03-10"}]},
                          "exDividendDate":{"raw":1741003200,"fmt":"2025-03-03"}
                        }}],"error":null}}
                        """, MediaType.APPLICATION_JSON));

        CalendarDates dates = client.fetchCalendar("AAPL");

        assertEquals(LocalDate.of(2025, 3, 10), dates.nextEarningsDate());
        assertEquals(LocalDate.of(2025, 3, 3), dates.nextExDividendDate());
    }

    @Test
    void missing_calendar_is_empty_not_error() {
        server.expect(requestTo(startsWith(BASE + "/v10/finance/quoteSummary/BTC-USD")))
                .andRespond(withSuccess("{\"quoteSummary\":{\"result\":[{}],\"error\":null}}", MediaType.APPLICATION_JSON));

        CalendarDates dates = client.fetchCalendar("BTC-USD");

        assertNull(dates.nextEarningsDate());
        assertNull(dates.nextExDividendDate());
    }

    @Test
    void classify_status_maps_known_codes() {
        assertEquals(UpstreamErrorType.NOT_FOUND, YahooFinanceClient.classifyStatus(404, null));
        assertEquals(UpstreamErrorType.TIMEOUT, YahooFinanceClient.classifyStatus(504, ""));
        assertEquals(UpstreamErrorType.RATE_LIMITED, YahooFinanceClient.classifyStatus(403, "Too Many Requests"));
        assertEquals(UpstreamErrorType.UNAVAILABLE, YahooFinanceClient.classifyStatus(500, "internal"));
    }
}
