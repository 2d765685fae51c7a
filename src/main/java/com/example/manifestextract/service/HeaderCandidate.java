package com.example.manifestextract.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scored header row. {@code columnMapping} binds field keys to 0-based column indexes.
 */
public record HeaderCandidate(
        int rowIndex,
        Map<String, Integer> columnMapping,
        double matchRatio
) {
    public HeaderCandidate {
        columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));
    }
}
