package com.example.manifestextract.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExtractionReportBuilder {

    public ExtractionResult build(SheetMatch match,
                                  ExtractedRows extracted,
                                  List<Map<String, Object>> records,
                                  List<RowError> rowErrors) {
        HeaderCandidate header = match.header();
        return new ExtractionResult(
                records,
                header.columnMapping().keySet(),
                extracted.rowsScanned(),
                rowErrors,
                match.sheet().name(),
                header.rowIndex() + 1,
                header.matchRatio(),
                true,
                oneBasedColumns(header.columnMapping())
        );
    }

    /**
     * Result for a workbook where no sheet reached the threshold. The best candidate, if any, is still
     * described so the caller can tell which columns were recognised.
     */
    public ExtractionResult noMatch(SheetMatch bestBelowThreshold) {
        if (bestBelowThreshold == null) {
            return ExtractionResult.empty();
        }
        HeaderCandidate header = bestBelowThreshold.header();
        return new ExtractionResult(
                List.of(),
                header.columnMapping().keySet(),
                0,
                List.of(),
                bestBelowThreshold.sheet().name(),
                header.rowIndex() + 1,
                header.matchRatio(),
                false,
                oneBasedColumns(header.columnMapping())
        );
    }

    private Map<String, Integer> oneBasedColumns(Map<String, Integer> columnMapping) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        columnMapping.forEach((key, index) -> columns.put(key, index + 1));
        return columns;
    }
}
