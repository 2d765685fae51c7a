package com.example.manifestextract.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RowExtractor {

    /**
     * Walks every row below the header. Rows empty in all mapped columns are padding and skipped.
     */
    public ExtractedRows extract(ManifestSheet sheet, int headerRowIndex, Map<String, Integer> columnMapping) {
        List<RawRow> rows = new ArrayList<>();
        int scanned = 0;
        for (int r = headerRowIndex + 1; r < sheet.rowCount(); r++) {
            scanned++;
            Map<String, CellValue> values = new LinkedHashMap<>();
            boolean hasData = false;
            for (Map.Entry<String, Integer> entry : columnMapping.entrySet()) {
                CellValue cell = sheet.cell(r, entry.getValue());
                values.put(entry.getKey(), cell);
                if (!cell.isEmpty()) {
                    hasData = true;
                }
            }
            if (!hasData) {
                continue;
            }
            rows.add(new RawRow(r + 1, values));
        }
        return new ExtractedRows(rows, scanned);
    }
}
