package com.stock.monitor.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final MonitorProperties properties;

    // 모든 업스트림 호출의 타임아웃은 fetch.call-timeout 하나로 통일
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getFetch().getCallTimeout())
                .setReadTimeout(properties.getFetch().getCallTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (stock-monitor)")
                .build();
    }
}
