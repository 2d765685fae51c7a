package com.example.manifestextract.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one extraction call.
 *
 * <p>{@code matched} is false when no sheet cleared the threshold. In that case {@code records} is empty,
 * while {@code matchRatio}, {@code sheetName} and {@code columnsFound} still describe the best candidate
 * seen so the caller can report which columns were recognised.
 *
 * @param records          cleaned rows keyed by field; empty optional fields are {@code null}
 * @param columnsFound     field keys bound to a column, in field declaration order
 * @param totalRowsScanned rows walked below the header, blank rows included
 * @param rowErrors        row-level problems in sheet order
 * @param sheetName        sheet the header was taken from, or {@code null}
 * @param headerRowNumber  1-based header row, or {@code null}
 * @param matchRatio       ratio of the best header candidate found anywhere
 * @param matched          whether the best candidate reached the threshold
 * @param columnMapping    field key to 1-based column number
 */
public record ExtractionResult(
        List<Map<String, Object>> records,
        Set<String> columnsFound,
        int totalRowsScanned,
        List<RowError> rowErrors,
        String sheetName,
        Integer headerRowNumber,
        double matchRatio,
        boolean matched,
        Map<String, Integer> columnMapping
) {
    public ExtractionResult {
        List<Map<String, Object>> recordCopy = new ArrayList<>();
        for (Map<String, Object> record : records) {
            recordCopy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        records = Collections.unmodifiableList(recordCopy);
        columnsFound = Collections.unmodifiableSet(new LinkedHashSet<>(columnsFound));
        rowErrors = List.copyOf(rowErrors);
        columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), Set.of(), 0, List.of(), null, null, 0, false, Map.of());
    }

    public int fatalErrorCount() {
        int count = 0;
        for (RowError error : rowErrors) {
            if (error.fatal()) {
                count++;
            }
        }
        return count;
    }
}
