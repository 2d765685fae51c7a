package com.example.manifestextract.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cells of one data row keyed by field. {@code rowNumber} is the 1-based row in the original sheet.
 */
public record RawRow(int rowNumber, Map<String, CellValue> values) {

    public RawRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public CellValue value(String key) {
        return values.getOrDefault(key, CellValue.EMPTY);
    }
}
