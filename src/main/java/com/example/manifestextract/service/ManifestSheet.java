package com.example.manifestextract.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only grid of decoded cells. Rows and cells past the end of a row read as {@link CellValue#EMPTY}.
 */
public record ManifestSheet(String name, List<List<CellValue>> rows) {

    public ManifestSheet {
        List<List<CellValue>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<CellValue> row : rows) {
                copy.add(row == null ? List.of() : List.copyOf(row));
            }
        }
        rows = Collections.unmodifiableList(copy);
        name = name == null ? "" : name;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<CellValue> row(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            return List.of();
        }
        return rows.get(rowIndex);
    }

    public CellValue cell(int rowIndex, int columnIndex) {
        List<CellValue> row = row(rowIndex);
        if (columnIndex < 0 || columnIndex >= row.size()) {
            return CellValue.EMPTY;
        }
        return row.get(columnIndex);
    }

    public boolean isBlankRow(int rowIndex) {
        for (CellValue cell : row(rowIndex)) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
