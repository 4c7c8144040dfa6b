package com.marketwatch.tracker.scrape.util;

import java.text.Normalizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PriceParser {
    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*)");

    private PriceParser() {
    }

    /**
     * Parses yen amounts such as "¥1,234", "1,234円" or "現在 1,234円".
     * Returns null when no amount is present.
     */
    public static Long parseYen(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        Matcher matcher = AMOUNT.matcher(normalized);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1).replace(",", "");
        if (digits.isEmpty() || digits.length() > 15) {
            return null;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
