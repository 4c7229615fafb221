package com.stock.monitor.backend.snapshot.vo;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexRecord {
    String symbol;
    String name;
    IndexKind kind;

    Double level;
    Double change;
    Double changePercent;
    List<Double> dailyCloses;
    Double weekChangePercent;

    String formattedLevel;   // "5,123.45"
    String formattedChange;  // "+12.34 (+0.24%)"
    boolean tradable;        // VIX = false
}
