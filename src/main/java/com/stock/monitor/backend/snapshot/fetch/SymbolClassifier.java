package com.stock.monitor.backend.snapshot.fetch;

import com.stock.monitor.backend.config.MonitorProperties;
import com.stock.monitor.backend.snapshot.vo.SymbolKind;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 심볼 접미사 규칙으로 EQUITY / ALWAYS_OPEN 구분. 실패하지 않는 순수 함수.
 */
@Component
public class SymbolClassifier {

    private final List<String> alwaysOpenSuffixes;

    @Autowired
    public SymbolClassifier(MonitorProperties properties) {
        this(properties.getAlwaysOpenSuffixes());
    }

    public SymbolClassifier(List<String> alwaysOpenSuffixes) {
        this.alwaysOpenSuffixes = alwaysOpenSuffixes == null
                ? List.of()
                : alwaysOpenSuffixes.stream().map(s -> s.trim().toUpperCase()).filter(s -> !s.isEmpty()).toList();
    }

    public SymbolKind classify(String symbol) {
        if (symbol == null) return SymbolKind.EQUITY;
        String s = symbol.trim().toUpperCase();
        for (String suffix : alwaysOpenSuffixes) {
            if (s.endsWith(suffix) && s.length() > suffix.length()) return SymbolKind.ALWAYS_OPEN;
        }
        return SymbolKind.EQUITY;
    }
}
