package com.myorg.normcontrol.service.processing;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Text clean-up shared by extraction and matching.
 */
public final class TextNormalizer {

    private TextNormalizer() {}

    /**
     * NFC form, no-break spaces turned into spaces, runs of horizontal whitespace collapsed.
     * Line breaks are kept; stamp fields are line oriented.
     */
    public static String normalize(String s) {
        if (s == null) return "";
        return Normalizer.normalize(s, Normalizer.Form.NFC)
                .replace('\u00A0', ' ')
                .replace('\u0000', ' ')
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ");
    }

    public static String truncate(String s, int maxLength) {
        if (s == null) return "";
        if (maxLength <= 0 || s.length() <= maxLength) return s;
        int end = maxLength;
        // do not cut a surrogate pair in half
        if (Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    public static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
