package com.stock.monitor.backend.market.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubNewsItemDTO {
    private long datetime;   // seconds
    private String headline;
    private String source;
    private String summary;
    private String url;
}
