package com.stock.monitor.backend.snapshot.vo;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SectorAggregate {
    String sector;
    double averageChangePercent;
    int count;
    List<String> symbols;
}
