package com.example.manifestextract.service;

import java.util.List;

public record ManifestWorkbook(List<ManifestSheet> sheets) {

    public ManifestWorkbook {
        sheets = sheets == null ? List.of() : List.copyOf(sheets);
    }

    public int sheetCount() {
        return sheets.size();
    }
}
