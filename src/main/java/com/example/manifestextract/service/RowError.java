package com.example.manifestextract.service;

/**
 * A row-level problem. {@code fatal} rows were left out of the records; the others were kept with the
 * offending field emptied.
 */
public record RowError(
        int rowNumber,
        String field,
        String message,
        boolean fatal
) {
}
