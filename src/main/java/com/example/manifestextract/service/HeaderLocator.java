package com.example.manifestextract.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the header row of a sheet among its leading rows.
 */
public class HeaderLocator {

    private final ColumnMatcher columnMatcher;

    public HeaderLocator(ColumnMatcher columnMatcher) {
        this.columnMatcher = columnMatcher;
    }

    /**
     * Best header candidate within the search window that reaches the threshold.
     */
    public Optional<HeaderCandidate> locate(ManifestSheet sheet, List<TargetField> fields, ExtractionOptions options) {
        return bestCandidate(sheet, fields, options.maxHeaderSearchRows(), options.ratioMode())
                .filter(candidate -> options.accepts(candidate.matchRatio()));
    }

    /**
     * Highest-ratio row among the first {@code maxSearchRows} rows, threshold ignored. Ties keep the topmost
     * row; rows without a single matched column are never candidates.
     */
    public Optional<HeaderCandidate> bestCandidate(ManifestSheet sheet,
                                                   List<TargetField> fields,
                                                   int maxSearchRows,
                                                   MatchRatioMode ratioMode) {
        int last = Math.min(maxSearchRows, sheet.rowCount());
        HeaderCandidate best = null;
        for (int r = 0; r < last; r++) {
            if (sheet.isBlankRow(r)) {
                continue;
            }
            List<String> normalized = new ArrayList<>();
            for (CellValue cell : sheet.row(r)) {
                normalized.add(HeaderNormalizer.normalize(cell));
            }
            Map<String, Integer> mapping = columnMatcher.mapColumns(normalized, fields);
            if (mapping.isEmpty()) {
                continue;
            }
            double ratio = ratioMode.ratio(mapping, fields);
            if (best == null || ratio > best.matchRatio()) {
                best = new HeaderCandidate(r, mapping, ratio);
            }
        }
        return Optional.ofNullable(best);
    }
}
