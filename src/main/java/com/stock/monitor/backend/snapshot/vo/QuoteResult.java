package com.stock.monitor.backend.snapshot.vo;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 심볼 1개에 대한 fetch 결과: PRESENT(record) 또는 ABSENT(reason).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QuoteResult {

    public enum Status { PRESENT, ABSENT }

    String symbol;
    Status status;
    QuoteRecord record;
    AbsentReason reason;
    String detail;

    public static QuoteResult present(QuoteRecord record) {
        return new QuoteResult(record.getSymbol(), Status.PRESENT, record, null, null);
    }

    public static QuoteResult absent(String symbol, AbsentReason reason, String detail) {
        return new QuoteResult(symbol, Status.ABSENT, null, reason, detail);
    }

    public boolean isPresent() {
        return status == Status.PRESENT;
    }
}
