package com.example.manifestextract.service;

import java.util.List;

/**
 * @param rows        non-blank data rows in sheet order
 * @param rowsScanned every row walked below the header, blank padding included
 */
public record ExtractedRows(List<RawRow> rows, int rowsScanned) {

    public ExtractedRows {
        rows = List.copyOf(rows);
    }
}
