package com.example.manifestextract.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One raw spreadsheet cell. Exactly one of {@code text}, {@code number} or {@code date} is set,
 * matching {@code kind}; an {@link CellKind#EMPTY} cell carries none of them.
 */
public record CellValue(
        CellKind kind,
        String text,
        BigDecimal number,
        LocalDate date
) {
    public static final CellValue EMPTY = new CellValue(CellKind.EMPTY, null, null, null);

    public CellValue {
        Objects.requireNonNull(kind, "kind");
    }

    public static CellValue text(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        return new CellValue(CellKind.TEXT, value, null, null);
    }

    public static CellValue number(BigDecimal value) {
        return value == null ? EMPTY : new CellValue(CellKind.NUMBER, null, value, null);
    }

    public static CellValue number(double value) {
        return number(BigDecimal.valueOf(value));
    }

    public static CellValue date(LocalDate value) {
        return value == null ? EMPTY : new CellValue(CellKind.DATE, null, null, value);
    }

    public boolean isEmpty() {
        return kind == CellKind.EMPTY;
    }

    /**
     * Display form of the cell: the text itself, a plain number without trailing zeros,
     * or an ISO date. Empty cells give an empty string.
     */
    public String asText() {
        if (kind == CellKind.TEXT) {
            return text;
        }
        if (kind == CellKind.NUMBER) {
            return number.stripTrailingZeros().toPlainString();
        }
        if (kind == CellKind.DATE) {
            return date.toString();
        }
        return "";
    }
}
