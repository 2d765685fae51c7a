package com.example.manifestextract.service;

import lombok.Getter;

/**
 * The chosen sheet holds more data rows than one upload may carry. The file itself is readable.
 */
@Getter
public class RowLimitExceededException extends RuntimeException {

    private final int rowCount;
    private final int maxRows;

    public RowLimitExceededException(int rowCount, int maxRows) {
        super("Too many rows (" + rowCount + "). Maximum " + maxRows + " rows allowed.");
        this.rowCount = rowCount;
        this.maxRows = maxRows;
    }
}
