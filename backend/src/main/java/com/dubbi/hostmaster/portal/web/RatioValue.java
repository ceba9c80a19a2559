package com.dubbi.hostmaster.portal.web;

import com.dubbi.hostmaster.portal.error.StructuralException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utilisation figure printed as {@code 12.34% (100/1024)}.
 */
public record RatioValue(long used, long total, double percent) {
    private static final Pattern PAREN = Pattern.compile("\\(([^)]*)\\)");

    public static RatioValue parse(String text) {
        Matcher m = PAREN.matcher(text);
        if (!m.find()) {
            throw new StructuralException("no utilisation data in '" + text + "'");
        }
        String[] parts = m.group(1).split("/");
        int pct = text.indexOf('%');
        if (parts.length != 2 || pct < 0) {
            throw new StructuralException("unexpected utilisation format '" + text + "'");
        }
        try {
            return new RatioValue(
                    Long.parseLong(parts[0].trim()),
                    Long.parseLong(parts[1].trim()),
                    Double.parseDouble(text.substring(0, pct).trim()));
        } catch (NumberFormatException e) {
            throw new StructuralException("unexpected utilisation format '" + text + "': " + e.getMessage());
        }
    }
}
