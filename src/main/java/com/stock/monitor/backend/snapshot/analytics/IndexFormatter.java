package com.stock.monitor.backend.snapshot.analytics;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * 지수 표시용 문자열. "5,123.45" / "+12.34 (+0.24%)"
 */
public final class IndexFormatter {

    public static final String NOT_AVAILABLE = "N/A";

    private static final ThreadLocal<DecimalFormat> LEVEL = ThreadLocal.withInitial(
            () -> new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US)));

    private static final ThreadLocal<DecimalFormat> SIGNED = ThreadLocal.withInitial(
            () -> new DecimalFormat("+#,##0.00;-#,##0.00", DecimalFormatSymbols.getInstance(Locale.US)));

    private IndexFormatter() {
    }

    public static String formatLevel(Double level) {
        if (level == null) return NOT_AVAILABLE;
        return LEVEL.get().format(level);
    }

    public static String formatChange(Double change, Double changePercent) {
        if (change == null || changePercent == null) return NOT_AVAILABLE;
        DecimalFormat f = SIGNED.get();
        return f.format(change) + " (" + f.format(changePercent) + "%)";
    }
}
