package com.example.manifestextract.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces header text to a comparable form: lower case, single spaces, only {@code [a-z0-9 /&]}.
 */
public final class HeaderNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern NON_HEADER_CHARS = Pattern.compile("[^a-z0-9 /&]");

    private HeaderNormalizer() {
    }

    public static String normalize(CellValue cell) {
        if (cell == null || cell.kind() != CellKind.TEXT) {
            return "";
        }
        return normalize(cell.text());
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        // underscores in field keys read as word breaks
        String s = raw.toLowerCase(Locale.ROOT).replace('_', ' ');
        s = WHITESPACE.matcher(s).replaceAll(" ");
        s = NON_HEADER_CHARS.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }
}
