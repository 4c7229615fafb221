package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolClassifierTest {

    private final SymbolClassifier classifier = new SymbolClassifier(List.of("-USD"));

    @Test
    void crypto_pair_is_always_open() {
        assertEquals(SymbolKind.ALWAYS_OPEN, classifier.classify("BTC-USD"));
        assertEquals(SymbolKind.ALWAYS_OPEN, classifier.classify("eth-usd"));
    }

    @Test
    void plain_ticker_is_equity() {
        assertEquals(SymbolKind.EQUITY, classifier.classify("AAPL"));
        assertEquals(SymbolKind.EQUITY, classifier.classify("BRK-B"));
    }

    @Test
    void suffix_alone_or_null_is_equity() {
        assertEquals(SymbolKind.EQUITY, classifier.classify("-USD"));
        assertEquals(SymbolKind.EQUITY, classifier.classify(null));
    }
}
