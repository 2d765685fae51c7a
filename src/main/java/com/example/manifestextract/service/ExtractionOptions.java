package com.example.manifestextract.service;

/**
 * Per-call tuning of the header search. Thresholds are always read against {@code ratioMode}.
 * A {@code maxRows} of {@link #NO_ROW_LIMIT} accepts any number of data rows.
 */
public record ExtractionOptions(
        int maxHeaderSearchRows,
        double minColumnMatchThreshold,
        MatchRatioMode ratioMode,
        int maxRows
) {
    public static final int DEFAULT_MAX_HEADER_SEARCH_ROWS = 20;
    public static final double DEFAULT_MIN_COLUMN_MATCH_THRESHOLD = 0.5;
    public static final int NO_ROW_LIMIT = 0;

    private static final double RATIO_EPSILON = 1e-9;

    public ExtractionOptions {
        if (maxHeaderSearchRows <= 0) {
            throw new IllegalArgumentException("maxHeaderSearchRows must be positive: " + maxHeaderSearchRows);
        }
        if (!(minColumnMatchThreshold > 0 && minColumnMatchThreshold <= 1)) {
            throw new IllegalArgumentException(
                    "minColumnMatchThreshold must be in (0, 1]: " + minColumnMatchThreshold);
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must not be negative: " + maxRows);
        }
        ratioMode = ratioMode == null ? MatchRatioMode.REQUIRED_ONLY : ratioMode;
    }

    public ExtractionOptions(int maxHeaderSearchRows, double minColumnMatchThreshold, MatchRatioMode ratioMode) {
        this(maxHeaderSearchRows, minColumnMatchThreshold, ratioMode, NO_ROW_LIMIT);
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(DEFAULT_MAX_HEADER_SEARCH_ROWS, DEFAULT_MIN_COLUMN_MATCH_THRESHOLD,
                MatchRatioMode.REQUIRED_ONLY);
    }

    public ExtractionOptions withThreshold(double threshold) {
        return new ExtractionOptions(maxHeaderSearchRows, threshold, ratioMode, maxRows);
    }

    public ExtractionOptions withMaxHeaderSearchRows(int rows) {
        return new ExtractionOptions(rows, minColumnMatchThreshold, ratioMode, maxRows);
    }

    public ExtractionOptions withMaxRows(int rows) {
        return new ExtractionOptions(maxHeaderSearchRows, minColumnMatchThreshold, ratioMode, rows);
    }

    public boolean accepts(double matchRatio) {
        return matchRatio + RATIO_EPSILON >= minColumnMatchThreshold;
    }

    public boolean exceedsRowLimit(int dataRows) {
        return maxRows != NO_ROW_LIMIT && dataRows > maxRows;
    }
}
